package by.radioegor146.unflatten;

import picocli.CommandLine;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitOption;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

public class Main {

    private static final String VERSION = "1.0.0";

    @CommandLine.Command(name = "opaque-unflattener", mixinStandardHelpOptions = true, version = "opaque-unflattener " + VERSION,
            description = "Removes opaque predicates and flattened dispatch from the methods of a .jar file")
    private static class UnflattenerRunner implements Callable<Integer> {

        @CommandLine.Parameters(index = "0", description = "Jar file to deobfuscate")
        private File jarFile;

        @CommandLine.Parameters(index = "1", description = "Output directory")
        private String outputDirectory;

        @CommandLine.Option(names = {"-l", "--libraries"}, description = "Directory for dependent libraries")
        private File librariesDirectory;

        @CommandLine.Option(names = {"-b", "--black-list"}, description = "File with a list of blacklist classes/methods")
        private File blackListFile;

        @CommandLine.Option(names = {"-w", "--white-list"}, description = "File with a list of whitelist classes/methods")
        private File whiteListFile;

        @CommandLine.Option(names = {"--module-type-pattern"}, defaultValue = DeobfuscatorConfig.DEFAULT_MODULE_TYPE_PATTERN,
                description = "Regex for simple names of classes holding opaque fields (default: ${DEFAULT-VALUE})")
        private String moduleTypePattern;

        @CommandLine.Option(names = {"--sentinel"}, defaultValue = "992",
                description = "Constant compared against in sentinel return blocks (default: ${DEFAULT-VALUE})")
        private int sentinel;

        @CommandLine.Option(names = {"--search-window"}, defaultValue = "20",
                description = "Instructions scanned backwards for opaque field arithmetic (default: ${DEFAULT-VALUE})")
        private int searchWindow;

        @CommandLine.Option(names = {"--merge-cap"}, defaultValue = "10",
                description = "Maximum empty block merge iterations (default: ${DEFAULT-VALUE})")
        private int mergeCap;

        @CommandLine.Option(names = {"-v", "--verbose"},
                description = "Increase diagnostics: -v per-method details, -vv full dumps")
        private boolean[] verbose = new boolean[0];

        @Override
        public Integer call() throws Exception {
            List<Path> libs = new ArrayList<>();
            if (librariesDirectory != null) {
                try (Stream<Path> files = Files.walk(librariesDirectory.toPath(), FileVisitOption.FOLLOW_LINKS)) {
                    files.filter(f -> f.toString().endsWith(".jar") || f.toString().endsWith(".zip"))
                            .forEach(libs::add);
                }
            }

            List<String> blackList = new ArrayList<>();
            if (blackListFile != null) {
                blackList = Files.readAllLines(blackListFile.toPath(), StandardCharsets.UTF_8);
            }

            List<String> whiteList = null;
            if (whiteListFile != null) {
                whiteList = Files.readAllLines(whiteListFile.toPath(), StandardCharsets.UTF_8);
            }

            DeobfuscatorConfig config = new DeobfuscatorConfig.Builder()
                    .setInputJarPath(jarFile.toPath())
                    .setOutputDir(Paths.get(outputDirectory))
                    .setInputLibs(libs)
                    .setBlackList(blackList)
                    .setWhiteList(whiteList)
                    .setModuleTypePattern(moduleTypePattern)
                    .setSentinelValue(sentinel)
                    .setBackwardSearchWindow(searchWindow)
                    .setMergeIterationCap(mergeCap)
                    .setVerbosity(DeobfuscatorConfig.Verbosity.fromCount(verbose.length))
                    .build();

            config.validateAndWarn();

            new JarDeobfuscator().process(config);

            return 0;
        }
    }

    public static void main(String[] args) throws IOException {
        System.exit(new CommandLine(new UnflattenerRunner()).execute(args));
    }
}
