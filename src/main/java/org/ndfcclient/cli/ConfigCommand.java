package org.ndfcclient.cli;

import org.ndfcclient.rest.Results;
import org.springframework.boot.ApplicationArguments;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

/**
 * A command driven by a YAML request document given with {@code --config=<file>}.
 *
 * Mutating commands register their requests in the {@link Results} passed to
 * {@link #process}; once processing ends, successfully or not, the summary of the
 * registered requests is printed.
 *
 * @param <T> Request item type
 */
public abstract class ConfigCommand<T> extends AbstractCommand {

    private final ConfigFileReader configFileReader;
    private final Class<T> itemType;

    protected ConfigCommand(String name, String description, ConfigFileReader configFileReader, Class<T> itemType) {
        super(name, description);
        this.configFileReader = configFileReader;
        this.itemType = itemType;
    }

    @Override
    public void execute(ApplicationArguments args, PrintStream out) {
        List<String> values = args.getOptionValues("config");
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            throw new UsageException(getName() + " requires --config=<file>");
        }
        List<T> items = configFileReader.read(Path.of(values.get(0)), itemType);

        Results results = new Results();
        try {
            process(items, results, out);
        } finally {
            if (results.size() > 0) {
                print(out, results.finalResult());
            }
        }
    }

    /**
     * Processes the validated request items in document order.
     */
    protected abstract void process(List<T> items, Results results, PrintStream out);
}
