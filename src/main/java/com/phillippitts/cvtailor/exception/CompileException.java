package com.phillippitts.cvtailor.exception;

/**
 * Thrown when an external document tool (pdflatex, pdfinfo, pdftotext) fails.
 * The message carries the tool diagnostics so it can be fed back into a corrective prompt.
 */
public class CompileException extends CvTailorException {

    private final String toolName;
    private final String diagnostics;

    public CompileException(String message, String toolName, String diagnostics) {
        super(message + " (tool: " + toolName + ")");
        this.toolName = toolName;
        this.diagnostics = diagnostics == null ? "" : diagnostics;
    }

    public CompileException(String message, String toolName, String diagnostics, Throwable cause) {
        super(message + " (tool: " + toolName + ")", cause);
        this.toolName = toolName;
        this.diagnostics = diagnostics == null ? "" : diagnostics;
    }

    public String getToolName() {
        return toolName;
    }

    /**
     * @return captured tool output relevant to the failure, never null
     */
    public String getDiagnostics() {
        return diagnostics;
    }
}
