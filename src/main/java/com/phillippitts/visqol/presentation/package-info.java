/**
 * Presentation layer (command-line front end).
 *
 * <p>Depends on services but not vice versa. Runners are thin adapters: they parse flags,
 * delegate to the engine or batch service, and translate domain exceptions into stderr messages
 * and exit codes.
 *
 * @see com.phillippitts.visqol.presentation.cli.VisqolCommandLineRunner
 */
package com.phillippitts.visqol.presentation;
