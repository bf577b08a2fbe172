package by.radioegor146.unflatten;

import by.radioegor146.unflatten.analysis.ConstantPropagator;
import by.radioegor146.unflatten.analysis.MethodCensus;
import by.radioegor146.unflatten.analysis.PropagationResult;
import by.radioegor146.unflatten.analysis.ReachabilityAnalyzer;
import by.radioegor146.unflatten.analysis.ReachabilityReport;
import by.radioegor146.unflatten.blocks.BlockGraph;
import by.radioegor146.unflatten.debug.AsmDebug;
import by.radioegor146.unflatten.frame.AsmSanity;
import by.radioegor146.unflatten.optimize.BlockOptimizerPipeline;
import by.radioegor146.unflatten.pattern.AsyncMethodDetector;
import by.radioegor146.unflatten.pattern.Decoy;
import by.radioegor146.unflatten.pattern.DecoyRecognizer;
import by.radioegor146.unflatten.rewrite.EmptyBlockMerger;
import by.radioegor146.unflatten.rewrite.GraphRewriter;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.tree.analysis.AnalyzerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs the per-block optimizers and then the whole-method decoy removal on one method.
 * <p>
 * Each stage works on a copy of the method and installs the result only when the rewritten graph
 * validates and the flattened body verifies. A failing stage leaves the method as it was.
 */
public class MethodDeobfuscator {

    private static final Logger logger = LoggerFactory.getLogger(MethodDeobfuscator.class);

    private interface Stage {
        boolean apply(BlockGraph graph, MethodNode original, String name);
    }

    private final AnalysisContext context;
    private final BlockOptimizerPipeline pipeline;
    private final AsyncMethodDetector asyncDetector;
    private final ConstantPropagator propagator;
    private final DecoyRecognizer recognizer;
    private final GraphRewriter rewriter;

    public MethodDeobfuscator(AnalysisContext context) {
        DeobfuscatorConfig config = context.getConfig();
        this.context = context;
        this.pipeline = BlockOptimizerPipeline.standard(config.getMaxBlockPasses());
        this.asyncDetector = new AsyncMethodDetector(config, context.getOpaqueLoads().getResolver());
        this.propagator = new ConstantPropagator(context.getOpaqueLoads());
        this.recognizer = new DecoyRecognizer(config.getSentinelValue());
        this.rewriter = new GraphRewriter(new EmptyBlockMerger(config.getMergeIterationCap()));
    }

    /** @return whether the method body was replaced */
    public boolean deobfuscate(String owner, MethodNode method) {
        if (!BlockGraph.canBuild(method)) {
            return false;
        }
        String name = owner + "." + method.name + method.desc;
        boolean changed = runStage(owner, name, method, "optimize blocks of", this::optimizeBlocks);
        changed |= runStage(owner, name, method, "finalize", this::finalizeMethod);
        if (changed) {
            context.methodSimplified();
            context.getDiagnostics().summary("Simplified {}", name);
        }
        return changed;
    }

    private boolean runStage(String owner, String name, MethodNode method, String what, Stage stage) {
        MethodNode copy = AsmSanity.copyOf(method);
        try {
            BlockGraph graph = BlockGraph.build(copy);
            if (!stage.apply(graph, method, name)) {
                return false;
            }
            graph.validate();
            graph.flattenInto(copy);
            AsmSanity.verify(owner, copy);
            AsmSanity.install(method, copy);
            return true;
        } catch (AnalyzerException | RuntimeException e) {
            logger.warn("Failed to {} {}: {}", what, name, e.getMessage());
            logger.debug("Stack trace", e);
            context.getDiagnostics().dump("Rejected body of " + name, () -> AsmDebug.disassembleWithIndex(copy));
            context.methodFailed();
            return false;
        }
    }

    private boolean optimizeBlocks(BlockGraph graph, MethodNode original, String name) {
        return pipeline.run(graph, context);
    }

    private boolean finalizeMethod(BlockGraph graph, MethodNode original, String name) {
        Diagnostics diagnostics = context.getDiagnostics();
        ReachabilityReport reachability = ReachabilityAnalyzer.analyze(graph, true);
        boolean asyncStyle = asyncDetector.isAsyncStyle(original);
        diagnostics.detail("{}: {} blocks, {}", name, graph.size(), reachability);
        MethodCensus.of(graph, context.getOpaqueLoads()).log(diagnostics, name, asyncStyle);
        if (!asyncStyle) {
            return false;
        }

        diagnostics.dump("Before finalize " + name, () -> AsmDebug.dumpGraph(graph));
        PropagationResult constants = propagator.propagate(graph);
        List<Decoy> decoys = recognizer.recognize(graph, constants);
        if (decoys.isEmpty()) {
            return false;
        }
        for (Decoy decoy : decoys) {
            diagnostics.detail("  {}", decoy);
        }
        int removed = rewriter.rewrite(graph, decoys);

        List<Decoy> noops = recognizer.recognizeInitializationNoops(graph);
        for (Decoy decoy : noops) {
            diagnostics.detail("  {}", decoy);
        }
        if (!noops.isEmpty()) {
            removed += rewriter.rewrite(graph, noops);
        }
        context.addDecoysRemoved(removed);
        diagnostics.dump("After finalize " + name, () -> AsmDebug.dumpGraph(graph));
        return true;
    }
}
