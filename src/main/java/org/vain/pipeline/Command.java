package org.vain.pipeline;

import org.vain.codegen.EmitterContext;
import org.vain.codegen.Generator;
import org.vain.codegen.PrettyPrintGenerator;
import org.vain.codegen.SexpDumpGenerator;
import org.vain.codegen.VimGenerator;

import java.util.function.Function;

/**
 * The sub-commands of the command line, each choosing a generator and whether
 * the analyzer runs.
 */
public enum Command {
    BUILD("build", true, VimGenerator::new),
    FMT("fmt", false, PrettyPrintGenerator::new),
    DUMP("dump", false, SexpDumpGenerator::new);

    public final String name;
    public final boolean analyze;
    private final Function<EmitterContext, Generator> generatorFactory;

    Command(String name, boolean analyze, Function<EmitterContext, Generator> generatorFactory) {
        this.name = name;
        this.analyze = analyze;
        this.generatorFactory = generatorFactory;
    }

    public Generator newGenerator(EmitterContext ctx) {
        return generatorFactory.apply(ctx);
    }

    public static Command fromName(String name) {
        for (Command command : values()) {
            if (command.name.equals(name)) {
                return command;
            }
        }
        return null;
    }
}
