package io.feydor;

import io.feydor.abc.Abc;
import io.feydor.abc.AbcError;
import io.feydor.abc.fmt.FormatterConfig;
import io.feydor.util.FileIo;

import java.io.File;
import java.io.IOException;
import java.util.*;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

enum AbcCliMode {
    PRINT,
    WRITE,
    CHECK
}

/**
 * Formats ABC files: re-spaces the music and aligns the voices of multi-voice tunes.
 *
 * <p>Usage: java AbcFormatterCli [options] file1.abc dir/ ...</p>
 */
public final class AbcFormatterCli {
    private final FormatterConfig config;
    private final AbcCliMode mode;
    private final boolean json;

    public static void main(String[] args) {
        if (args.length < 1 || args[0].isBlank()) {
            printOptions();
            System.exit(1);
            return;
        }

        List<File> files = new ArrayList<>();
        var mode = AbcCliMode.PRINT;
        boolean verbose = false, json = false;
        File configFile = null;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-V", "--version" -> {
                    printVersion();
                    System.exit(0);
                    return;
                }
                case "-h", "-H", "--help" -> {
                    printOptions();
                    System.exit(0);
                    return;
                }
                case "-c", "--check" -> mode = AbcCliMode.CHECK;
                case "-w", "--write" -> mode = AbcCliMode.WRITE;
                case "-j", "--json" -> json = true;
                case "-v", "--verbose" -> verbose = true;
                case "--config" -> {
                    if (i + 1 >= args.length) {
                        System.err.println("--config needs a file");
                        System.exit(2);
                        return;
                    }
                    configFile = new File(args[++i]);
                }
                default -> files.addAll(parseFiles(arg));
            }
        }

        if (verbose) {
            enableVerboseLogging();
        }
        var config = configFile == null ? FormatterConfig.defaults() : FormatterConfig.load(configFile);
        var cli = new AbcFormatterCli(config, mode, json);
        System.exit(cli.run(files));
    }

    public AbcFormatterCli(FormatterConfig config, AbcCliMode mode, boolean json) {
        this.config = config;
        this.mode = mode;
        this.json = json;
    }

    /** @return The process exit code: 0 when every file was formatted (or, with --check, already formatted) */
    public int run(List<File> files) {
        int exitCode = 0;
        var diagnostics = new ArrayList<Map<String, Object>>();
        for (var file : files) {
            Abc abc;
            try {
                abc = Abc.read(file);
            } catch (IOException e) {
                System.err.printf("The file failed to load: %s\n%s. Skipping...\n", file.getAbsolutePath(), e.getMessage());
                exitCode = 1;
                continue;
            }

            for (var error : abc.getErrors()) {
                diagnostics.add(toJsonObject(abc.filename, error));
                if (!json) {
                    System.err.printf("%s:%s\n", abc.filename, error);
                }
            }
            if (!abc.isParsed()) {
                System.err.printf("The ABC file failed to parse: %s. Skipping...\n", file.getAbsolutePath());
                exitCode = 1;
                continue;
            }

            String formatted = abc.format(config);
            switch (mode) {
                case PRINT -> System.out.print(formatted);
                case WRITE -> {
                    try {
                        if (!formatted.equals(abc.getSource())) {
                            FileIo.writeString(file, formatted);
                        }
                    } catch (IOException e) {
                        System.err.printf("The file failed to save: %s\n%s\n", file.getAbsolutePath(), e.getMessage());
                        exitCode = 1;
                    }
                }
                case CHECK -> {
                    if (!formatted.equals(abc.getSource()) || !abc.getErrors().isEmpty()) {
                        System.err.printf("Not formatted: %s\n", file.getPath());
                        exitCode = 1;
                    }
                }
            }
        }

        if (json) {
            System.out.println(FileIo.toPrettyJson(diagnostics));
        }
        return exitCode;
    }

    static Map<String, Object> toJsonObject(String filename, AbcError error) {
        var object = new LinkedHashMap<String, Object>();
        object.put("file", filename);
        object.put("line", error.line());
        object.put("column", error.column());
        object.put("origin", error.origin().name());
        object.put("message", error.message());
        object.put("token", error.token().lexeme());
        return object;
    }

    private static void enableVerboseLogging() {
        Logger root = Logger.getLogger("");
        root.setLevel(Level.FINE);
        for (var handler : root.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(Level.FINE);
            }
        }
    }

    private static List<File> parseFiles(String filename) {
        if (!filename.isBlank() && filename.charAt(0) != '-') {
            File file = new File(filename);
            if (file.isDirectory()) {
                File[] dirFiles = file.listFiles((dir, name) -> name.toLowerCase().endsWith(".abc"));
                if (dirFiles != null) {
                    Arrays.sort(dirFiles);
                    return List.of(dirFiles);
                }
            } else {
                return List.of(file);
            }
        }
        return List.of();
    }

    private static void printOptions() {
        String msg = "\nCOOL ABC\n\nUsage: abcfmt [options] [ABC Files or directories]\n\n";
        msg += "Options:\n";
        msg += "\n  -c,--check       Exit with 1 if a file is not formatted or has errors";
        msg += "\n  -w,--write       Rewrite the files in place";
        msg += "\n  -j,--json        Print the diagnostics as JSON";
        msg += "\n  --config FILE    Formatter settings overriding the defaults";
        msg += "\n  -V,--version     Print version information";
        msg += "\n  -h,--help        Print this message";
        msg += "\n  -v,--verbose     Print extra logs";
        System.out.println(msg);
    }

    private static void printVersion() {
        System.out.println("COOL ABC 0.1.0\nCopyright (C) 2023 feydor\n");
    }
}
