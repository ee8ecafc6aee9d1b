package org.vain.codegen;

import org.vain.ArgumentParser;
import org.vain.runtime.ErrorMessageUtil;

/**
 * The EmitterContext class holds the per-file information shared by the parser,
 * the analyzer and the generators: the file name, the error formatter and the
 * compiler options that control debug output.
 */
public class EmitterContext {

    /**
     * CompilerOptions holds the settings and flags given on the command line.
     */
    public final ArgumentParser.CompilerOptions compilerOptions;

    /**
     * The source file, as given on the command line.
     */
    public final String fileName;

    /**
     * Formats error messages with file, line and column.
     */
    public final ErrorMessageUtil errorUtil;

    public EmitterContext(String fileName, ArgumentParser.CompilerOptions compilerOptions) {
        this.fileName = fileName;
        this.compilerOptions = compilerOptions;
        this.errorUtil = new ErrorMessageUtil(fileName);
    }

    public void logDebug(String message) {
        if (this.compilerOptions.debugEnabled) {
            System.out.println(message);
        }
    }

    @Override
    public String toString() {
        return "EmitterContext{\n" +
                "    fileName='" + fileName + "',\n" +
                "    compilerOptions=" + compilerOptions + "\n" +
                "}";
    }
}
