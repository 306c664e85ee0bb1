/**
 * One class per command line command.
 */
package org.ndfcclient.cli.commands;
