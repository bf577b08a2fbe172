package by.radioegor146.unflatten;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Configuration of a deobfuscation run: input and output locations, class filters, and the
 * thresholds used by the opaque field scan, the decoy recognizers and the block merger.
 */
public class DeobfuscatorConfig {

    private static final Logger logger = LoggerFactory.getLogger(DeobfuscatorConfig.class);

    public static final String DEFAULT_MODULE_TYPE_PATTERN = "\\$?Module.*";
    public static final int DEFAULT_SENTINEL = 992;
    public static final int DEFAULT_BACKWARD_SEARCH_WINDOW = 20;
    public static final int DEFAULT_MERGE_ITERATION_CAP = 10;
    public static final int DEFAULT_MAX_BLOCK_PASSES = 20;
    public static final int DEFAULT_MIN_MODULE_FIELDS = 3;
    public static final int DEFAULT_INITIALIZER_STORE_THRESHOLD = 10;
    public static final List<String> DEFAULT_ASYNC_WRAPPER_TYPES = List.of(
            "java/util/concurrent/CompletableFuture",
            "java/util/concurrent/CompletionStage",
            "java/util/concurrent/Future");
    public static final List<String> DEFAULT_CONTINUATION_METHODS = List.of("invokeSuspend");
    public static final String DEFAULT_CONTINUATION_TYPE = "kotlin/coroutines/Continuation";
    public static final String DEFAULT_ASYNC_SUFFIX = "Async";
    public static final List<String> DEFAULT_STATE_MACHINE_BASE_TYPES = List.of(
            "kotlin/coroutines/jvm/internal/BaseContinuationImpl",
            "kotlin/coroutines/jvm/internal/ContinuationImpl",
            "kotlin/coroutines/jvm/internal/RestrictedContinuationImpl",
            "kotlin/coroutines/jvm/internal/SuspendLambda",
            "kotlin/coroutines/jvm/internal/RestrictedSuspendLambda");
    public static final List<String> DEFAULT_STATE_FIELD_NAMES = List.of("label");
    public static final List<String> DEFAULT_ASYNC_INDICATOR_CALLS = List.of(
            "kotlin/coroutines/intrinsics/IntrinsicsKt.getCOROUTINE_SUSPENDED",
            "kotlin/coroutines/jvm/internal/DebugProbesKt.probeCoroutineSuspended");

    /** Amount of diagnostic output. */
    public enum Verbosity {
        SUMMARY,
        DETAIL,
        FULL_DUMP;

        public boolean includes(Verbosity other) {
            return ordinal() >= other.ordinal();
        }

        public static Verbosity fromCount(int flags) {
            Verbosity[] values = values();
            return values[Math.min(Math.max(flags, 0), values.length - 1)];
        }
    }

    private final Path inputJarPath;
    private final Path outputDir;
    private final List<Path> inputLibs;
    private final List<String> blackList;
    private final List<String> whiteList;
    private final Pattern moduleTypePattern;
    private final int sentinelValue;
    private final int backwardSearchWindow;
    private final int mergeIterationCap;
    private final int maxBlockPasses;
    private final int minModuleFields;
    private final int initializerStoreThreshold;
    private final List<String> asyncWrapperTypes;
    private final List<String> continuationMethodNames;
    private final String continuationType;
    private final String asyncSuffix;
    private final List<String> stateMachineBaseTypes;
    private final List<String> stateFieldNames;
    private final List<String> asyncIndicatorCalls;
    private final Verbosity verbosity;

    private DeobfuscatorConfig(Builder b) {
        this.inputJarPath = b.inputJarPath;
        this.outputDir = b.outputDir;
        this.inputLibs = b.inputLibs == null ? Collections.emptyList() : List.copyOf(b.inputLibs);
        this.blackList = b.blackList == null ? Collections.emptyList() : List.copyOf(b.blackList);
        this.whiteList = b.whiteList == null ? null : List.copyOf(b.whiteList);
        this.moduleTypePattern = Pattern.compile(b.moduleTypePattern);
        this.sentinelValue = b.sentinelValue;
        this.backwardSearchWindow = b.backwardSearchWindow;
        this.mergeIterationCap = b.mergeIterationCap;
        this.maxBlockPasses = b.maxBlockPasses;
        this.minModuleFields = b.minModuleFields;
        this.initializerStoreThreshold = b.initializerStoreThreshold;
        this.asyncWrapperTypes = List.copyOf(b.asyncWrapperTypes);
        this.continuationMethodNames = List.copyOf(b.continuationMethodNames);
        this.continuationType = b.continuationType;
        this.asyncSuffix = b.asyncSuffix;
        this.stateMachineBaseTypes = List.copyOf(b.stateMachineBaseTypes);
        this.stateFieldNames = List.copyOf(b.stateFieldNames);
        this.asyncIndicatorCalls = List.copyOf(b.asyncIndicatorCalls);
        this.verbosity = b.verbosity;
    }

    public static DeobfuscatorConfig defaults() {
        return new Builder().build();
    }

    public Path getInputJarPath() { return inputJarPath; }
    public Path getOutputDir() { return outputDir; }
    public List<Path> getInputLibs() { return inputLibs; }
    public List<String> getBlackList() { return blackList; }
    /** @return null when every class is allowed */
    public List<String> getWhiteList() { return whiteList; }
    public Pattern getModuleTypePattern() { return moduleTypePattern; }
    public int getSentinelValue() { return sentinelValue; }
    public int getBackwardSearchWindow() { return backwardSearchWindow; }
    public int getMergeIterationCap() { return mergeIterationCap; }
    public int getMaxBlockPasses() { return maxBlockPasses; }
    public int getMinModuleFields() { return minModuleFields; }
    public int getInitializerStoreThreshold() { return initializerStoreThreshold; }
    public List<String> getAsyncWrapperTypes() { return asyncWrapperTypes; }
    public List<String> getContinuationMethodNames() { return continuationMethodNames; }
    public String getContinuationType() { return continuationType; }
    public String getAsyncSuffix() { return asyncSuffix; }
    /** Super classes of compiler-generated state machine classes. */
    public List<String> getStateMachineBaseTypes() { return stateMachineBaseTypes; }
    /** Int fields of a state machine class that hold its state. */
    public List<String> getStateFieldNames() { return stateFieldNames; }
    /** Calls that only appear in state machine bodies, as {@code owner.name}. */
    public List<String> getAsyncIndicatorCalls() { return asyncIndicatorCalls; }
    public Verbosity getVerbosity() { return verbosity; }

    /** Matches the simple name (after the last {@code /}) of an internal class name. */
    public boolean isModuleType(String internalName) {
        String simple = internalName.substring(internalName.lastIndexOf('/') + 1);
        return moduleTypePattern.matcher(simple).matches();
    }

    /**
     * Logs warnings for settings that will most likely disable part of the analysis.
     */
    public void validateAndWarn() {
        if (mergeIterationCap <= 0) {
            logger.warn("Merge iteration cap is {}, empty blocks will not be merged", mergeIterationCap);
        }
        if (maxBlockPasses <= 0) {
            logger.warn("Block pass limit is {}, field inlining is disabled", maxBlockPasses);
        }
        if (backwardSearchWindow <= 0) {
            logger.warn("Backward search window is {}, no opaque field can be resolved", backwardSearchWindow);
        }
        if (whiteList != null && whiteList.isEmpty()) {
            logger.warn("White list is empty, no class will be processed");
        }
        if (asyncWrapperTypes.isEmpty() && continuationMethodNames.isEmpty()
                && (asyncSuffix == null || asyncSuffix.isEmpty())
                && stateFieldNames.isEmpty() && asyncIndicatorCalls.isEmpty()) {
            logger.warn("No async method convention configured, decoy recognition never runs");
        }
    }

    @Override
    public String toString() {
        return String.format("DeobfuscatorConfig{\n" +
                        "  inputJar=%s,\n" +
                        "  outputDir=%s,\n" +
                        "  moduleTypePattern=%s,\n" +
                        "  sentinel=%d,\n" +
                        "  mergeCap=%d,\n" +
                        "  verbosity=%s\n" +
                        "}",
                inputJarPath, outputDir, moduleTypePattern, sentinelValue, mergeIterationCap, verbosity);
    }

    public static class Builder {
        private Path inputJarPath;
        private Path outputDir;
        private List<Path> inputLibs;
        private List<String> blackList;
        private List<String> whiteList;
        private String moduleTypePattern = DEFAULT_MODULE_TYPE_PATTERN;
        private int sentinelValue = DEFAULT_SENTINEL;
        private int backwardSearchWindow = DEFAULT_BACKWARD_SEARCH_WINDOW;
        private int mergeIterationCap = DEFAULT_MERGE_ITERATION_CAP;
        private int maxBlockPasses = DEFAULT_MAX_BLOCK_PASSES;
        private int minModuleFields = DEFAULT_MIN_MODULE_FIELDS;
        private int initializerStoreThreshold = DEFAULT_INITIALIZER_STORE_THRESHOLD;
        private List<String> asyncWrapperTypes = DEFAULT_ASYNC_WRAPPER_TYPES;
        private List<String> continuationMethodNames = DEFAULT_CONTINUATION_METHODS;
        private String continuationType = DEFAULT_CONTINUATION_TYPE;
        private String asyncSuffix = DEFAULT_ASYNC_SUFFIX;
        private List<String> stateMachineBaseTypes = DEFAULT_STATE_MACHINE_BASE_TYPES;
        private List<String> stateFieldNames = DEFAULT_STATE_FIELD_NAMES;
        private List<String> asyncIndicatorCalls = DEFAULT_ASYNC_INDICATOR_CALLS;
        private Verbosity verbosity = Verbosity.SUMMARY;

        public Builder setInputJarPath(Path inputJarPath) {
            this.inputJarPath = inputJarPath;
            return this;
        }

        public Builder setOutputDir(Path outputDir) {
            this.outputDir = outputDir;
            return this;
        }

        public Builder setInputLibs(List<Path> inputLibs) {
            this.inputLibs = inputLibs;
            return this;
        }

        public Builder setBlackList(List<String> blackList) {
            this.blackList = blackList;
            return this;
        }

        public Builder setWhiteList(List<String> whiteList) {
            this.whiteList = whiteList;
            return this;
        }

        public Builder setModuleTypePattern(String moduleTypePattern) {
            this.moduleTypePattern = moduleTypePattern;
            return this;
        }

        public Builder setSentinelValue(int sentinelValue) {
            this.sentinelValue = sentinelValue;
            return this;
        }

        public Builder setBackwardSearchWindow(int backwardSearchWindow) {
            this.backwardSearchWindow = backwardSearchWindow;
            return this;
        }

        public Builder setMergeIterationCap(int mergeIterationCap) {
            this.mergeIterationCap = mergeIterationCap;
            return this;
        }

        public Builder setMaxBlockPasses(int maxBlockPasses) {
            this.maxBlockPasses = maxBlockPasses;
            return this;
        }

        public Builder setMinModuleFields(int minModuleFields) {
            this.minModuleFields = minModuleFields;
            return this;
        }

        public Builder setInitializerStoreThreshold(int initializerStoreThreshold) {
            this.initializerStoreThreshold = initializerStoreThreshold;
            return this;
        }

        public Builder setAsyncWrapperTypes(List<String> asyncWrapperTypes) {
            this.asyncWrapperTypes = asyncWrapperTypes;
            return this;
        }

        public Builder setContinuationMethodNames(List<String> continuationMethodNames) {
            this.continuationMethodNames = continuationMethodNames;
            return this;
        }

        public Builder setContinuationType(String continuationType) {
            this.continuationType = continuationType;
            return this;
        }

        public Builder setAsyncSuffix(String asyncSuffix) {
            this.asyncSuffix = asyncSuffix;
            return this;
        }

        public Builder setStateMachineBaseTypes(List<String> stateMachineBaseTypes) {
            this.stateMachineBaseTypes = stateMachineBaseTypes;
            return this;
        }

        public Builder setStateFieldNames(List<String> stateFieldNames) {
            this.stateFieldNames = stateFieldNames;
            return this;
        }

        public Builder setAsyncIndicatorCalls(List<String> asyncIndicatorCalls) {
            this.asyncIndicatorCalls = asyncIndicatorCalls;
            return this;
        }

        public Builder setVerbosity(Verbosity verbosity) {
            this.verbosity = verbosity;
            return this;
        }

        public DeobfuscatorConfig build() {
            if (moduleTypePattern == null || verbosity == null) {
                throw new IllegalArgumentException("Module type pattern and verbosity are required");
            }
            return new DeobfuscatorConfig(this);
        }
    }
}
