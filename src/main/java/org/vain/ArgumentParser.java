package org.vain;

import org.vain.pipeline.Command;

import java.util.ArrayList;
import java.util.List;

/**
 * The ArgumentParser class is responsible for parsing command-line arguments
 * into a {@link CompilerOptions} object.
 * <p>
 * The first non-switch argument names the command ({@code build}, {@code fmt}
 * or {@code dump}); the remaining ones are files or directories.
 */
public class ArgumentParser {

    /**
     * Parses the command-line arguments and returns a CompilerOptions object
     * configured based on the provided arguments.
     *
     * @param args The command-line arguments to parse.
     * @return A CompilerOptions object with settings derived from the arguments.
     * @throws IllegalArgumentException for unknown switches, commands or bad values
     */
    public static CompilerOptions parseArguments(String[] args) {
        CompilerOptions parsedArgs = new CompilerOptions();
        boolean readingPaths = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (readingPaths || !arg.startsWith("-") || arg.equals("-")) {
                processNonSwitchArgument(parsedArgs, arg);
            } else if (arg.equals("--")) {
                // subsequent arguments are paths even if they start with "-"
                readingPaths = true;
            } else {
                i = processLongSwitches(args, parsedArgs, arg, i);
            }
        }
        return parsedArgs;
    }

    private static void processNonSwitchArgument(CompilerOptions parsedArgs, String arg) {
        if (parsedArgs.command == null) {
            Command command = Command.fromName(arg);
            if (command == null) {
                throw new IllegalArgumentException("Unknown command: " + arg + "  (--help will show valid commands)");
            }
            parsedArgs.command = command;
        } else {
            parsedArgs.paths.add(arg);
        }
    }

    /**
     * Processes long-form switches (e.g., --debug, --tokenize).
     *
     * @return The updated index after processing the switch and its value.
     */
    private static int processLongSwitches(String[] args, CompilerOptions parsedArgs, String arg, int index) {
        switch (arg) {
            case "--debug":
                parsedArgs.debugEnabled = true;
                break;
            case "--tokenize":
                validateExclusiveOptions(parsedArgs, "tokenize");
                parsedArgs.tokenizeOnly = true;
                break;
            case "--parse":
                validateExclusiveOptions(parsedArgs, "parse");
                parsedArgs.parseOnly = true;
                break;
            case "--config":
                parsedArgs.configFile = requireValue(args, index, arg);
                return index + 1;
            case "--jobs":
                String jobs = requireValue(args, index, arg);
                try {
                    parsedArgs.jobs = Integer.parseInt(jobs);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Invalid value for --jobs: " + jobs);
                }
                if (parsedArgs.jobs < 1) {
                    throw new IllegalArgumentException("Invalid value for --jobs: " + jobs);
                }
                return index + 1;
            case "--version":
                parsedArgs.versionRequested = true;
                break;
            case "-h":
            case "--help":
                parsedArgs.helpRequested = true;
                break;
            default:
                throw new IllegalArgumentException("Unrecognized switch: " + arg + "  (--help will show valid options)");
        }
        return index;
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index + 1 >= args.length) {
            throw new IllegalArgumentException("No value specified for " + option + ".");
        }
        return args[index + 1];
    }

    /**
     * Validates that exclusive options are not combined.
     */
    private static void validateExclusiveOptions(CompilerOptions parsedArgs, String option) {
        if (parsedArgs.tokenizeOnly || parsedArgs.parseOnly) {
            throw new IllegalArgumentException("--" + option + " cannot be combined with other exclusive options");
        }
    }

    public static void printHelp() {
        System.out.println("Usage: vain <command> [options] [paths...]");
        System.out.println();
        System.out.println("Commands:");
        System.out.println("  build                 compile to Vim script (<file>.vim)");
        System.out.println("  fmt                   pretty-print the source (<file>.vain.pretty);");
        System.out.println("                        comments inside (), [] and {} are not kept");
        System.out.println("  dump                  dump the syntax tree as s-expressions (<file>.vain.sexp)");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --config FILE         analyzer rule settings (default: " + Configuration.defaultConfigFileName + " if present)");
        System.out.println("  --jobs N              number of files compiled in parallel");
        System.out.println("  --debug               enable debugging mode");
        System.out.println("  --tokenize            print the tokens and stop");
        System.out.println("  --parse               print the syntax tree and stop");
        System.out.println("  --version             print the version");
        System.out.println("  -h, --help            displays this help message");
        System.out.println();
        System.out.println("Directories are searched recursively for *.vain files; no paths means the current directory.");
    }

    /**
     * CompilerOptions holds the settings and flags given on the command line.
     * <p>
     * Fields:
     * - command: what to produce; defaults to build.
     * - paths: files and directories to compile.
     * - debugEnabled: print progress of every stage to standard output.
     * - tokenizeOnly / parseOnly: print the tokens or the tree and stop.
     * - configFile: YAML file with analyzer rule settings.
     * - jobs: how many files are compiled at the same time.
     */
    public static class CompilerOptions implements Cloneable {
        public Command command = null;
        public List<String> paths = new ArrayList<>();
        public boolean debugEnabled = false;
        public boolean tokenizeOnly = false;
        public boolean parseOnly = false;
        public String configFile = null;
        public int jobs = Runtime.getRuntime().availableProcessors();
        public boolean versionRequested = false;
        public boolean helpRequested = false;

        public Command effectiveCommand() {
            return command != null ? command : Command.BUILD;
        }

        @Override
        public CompilerOptions clone() {
            try {
                CompilerOptions copy = (CompilerOptions) super.clone();
                copy.paths = new ArrayList<>(paths);
                return copy;
            } catch (CloneNotSupportedException e) {
                // This shouldn't happen, since we're implementing Cloneable
                throw new AssertionError();
            }
        }

        @Override
        public String toString() {
            return "CompilerOptions{\n" +
                    "    command=" + (command != null ? command.name : "null") + ",\n" +
                    "    paths=" + paths + ",\n" +
                    "    debugEnabled=" + debugEnabled + ",\n" +
                    "    tokenizeOnly=" + tokenizeOnly + ",\n" +
                    "    parseOnly=" + parseOnly + ",\n" +
                    "    configFile='" + configFile + "',\n" +
                    "    jobs=" + jobs + "\n" +
                    "}";
        }
    }
}
