// file: client/src/main/java/io/taskledger/client/CliConfig.java
package io.taskledger.client;

import java.nio.file.Path;
import java.util.Arrays;

/**
 * Global CLI options, parsed from the arguments that precede the command.
 *
 * Supports:
 *  - dataFile:  collection document (tasks + checksum)
 *  - auditFile: line-delimited audit log
 *  - actor:     identity recorded in audit entries
 *  - command:   remaining arguments, starting with the command name
 */
public record CliConfig(
        Path dataFile,
        Path auditFile,
        String actor,
        boolean help,
        String[] command
) {
    static final String DEFAULT_DATA = "data/tasks.json";
    static final String DEFAULT_AUDIT = "data/audit.log";
    static final String DEFAULT_ACTOR = "system";

    /**
     * Very small parser.
     *
     * Supported flags (before the command):
     *   --data,  -d <file>
     *   --audit, -a <file>
     *   --actor, -u <name>
     *   --help,  -h
     *
     * Parsing stops at the first argument that is not a global flag.
     */
    public static CliConfig fromArgs(String[] args) {
        String data = DEFAULT_DATA;
        String audit = DEFAULT_AUDIT;
        String actor = DEFAULT_ACTOR;
        boolean help = false;

        int i = 0;
        loop:
        for (; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> help = true;

                case "--data", "-d" -> {
                    ensureValue(args, i);
                    data = args[++i];
                }

                case "--audit", "-a" -> {
                    ensureValue(args, i);
                    audit = args[++i];
                }

                case "--actor", "-u" -> {
                    ensureValue(args, i);
                    actor = args[++i];
                }

                default -> {
                    if (args[i].startsWith("-")) {
                        throw new Cli.CliException("unknown option: " + args[i]);
                    }
                    break loop;
                }
            }
        }
        return new CliConfig(
                Path.of(data),
                Path.of(audit),
                actor,
                help,
                Arrays.copyOfRange(args, i, args.length)
        );
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new Cli.CliException("missing value for option: " + args[i]);
        }
    }
}
