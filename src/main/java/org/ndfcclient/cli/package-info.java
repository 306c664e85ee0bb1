/**
 * Command line client: argument dispatch, YAML request documents and JSON output.
 */
package org.ndfcclient.cli;
