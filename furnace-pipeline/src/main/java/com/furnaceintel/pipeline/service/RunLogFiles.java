package com.furnaceintel.pipeline.service;

import com.furnaceintel.pipeline.config.FurnacePipelineProperties;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Routes log output of one run into its own file.
 *
 * logback-spring.xml sifts on the {@value #MDC_KEY} MDC entry; while a {@link RunLog} is open,
 * everything logged on this thread also lands in {@code <logDir>/<mode>_<date>_<qualifier>_<pid>.log}.
 */
@Component
public class RunLogFiles {

    public static final String MDC_KEY = "runLog";

    private final Path logDir;

    public RunLogFiles(FurnacePipelineProperties properties) {
        this.logDir = Paths.get(properties.getOutput().getLogDir());
    }

    /**
     * @param qualifier range number for daily runs, HHmmss for live polls
     */
    public RunLog open(String mode, String dateFile, String qualifier) {
        String name = String.format("%s_%s_%s_%d", mode, dateFile, qualifier, ProcessHandle.current().pid());
        MDC.put(MDC_KEY, name);
        return new RunLog(logDir.resolve(name + ".log"));
    }

    public static final class RunLog implements AutoCloseable {

        private final Path path;

        private RunLog(Path path) {
            this.path = path;
        }

        public Path path() {
            return path;
        }

        @Override
        public void close() {
            MDC.remove(MDC_KEY);
        }
    }
}
