package com.phillippitts.visqol.service.backend.visqolcli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Seam over {@link ProcessBuilder} so process handling can be tested without a real binary.
 */
interface ProcessFactory {

    /**
     * @param command    full command line, executable first
     * @param workingDir working directory, may be null
     * @throws IOException if the process cannot be started
     */
    Process start(List<String> command, Path workingDir) throws IOException;
}
