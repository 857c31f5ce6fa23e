/**
 * Command-line entry points: argument parsing, exit codes and the {@code consume} command.
 */
package ca.gc.cra.feedback.api;
