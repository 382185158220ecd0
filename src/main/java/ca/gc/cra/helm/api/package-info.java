/**
 * Command-line entry points. {@link ca.gc.cra.helm.api.Main} dispatches to {@link ca.gc.cra.helm.api.ConsoleCli},
 * which reads commands from standard input and prints what the driven character says.
 */
package ca.gc.cra.helm.api;
