package com.vidnyan.attackpath.application.port.out;

import com.vidnyan.attackpath.application.port.in.AnalyzeGraphUseCase.AnalysisResult;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Raised when analysis output cannot be created or written.
 * Once the use case has completed the analysis, the exception also carries the
 * computed result so callers still get the paths that could not be exported.
 */
public class ExportIOException extends RuntimeException {

    private final transient Path file;
    private final transient AnalysisResult result;

    public ExportIOException(String message, Path file, Throwable cause) {
        this(message, file, cause, null);
    }

    public ExportIOException(String message, Path file, Throwable cause, AnalysisResult result) {
        super(message, cause);
        this.file = file;
        this.result = result;
    }

    /**
     * Copy of this exception carrying the computed analysis result.
     */
    public ExportIOException withResult(AnalysisResult analysisResult) {
        ExportIOException copy = new ExportIOException(getMessage(), file, getCause(), analysisResult);
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    /**
     * The file or directory that could not be written.
     */
    public Path file() {
        return file;
    }

    public Optional<AnalysisResult> result() {
        return Optional.ofNullable(result);
    }
}
