package com.repo.treemap.tree;

import com.repo.treemap.core.HierarchyRecord;
import com.repo.treemap.core.TreemapConfig;
import com.repo.treemap.diagnostics.DiagnosticsSink;
import com.repo.treemap.source.RecordSet;

import java.util.List;

/**
 * Build, analyze, rewrite. Each stage consumes the finished output of the previous one, so the
 * run is a pure function of the record set apart from what it reports to the sink.
 */
public class TreemapPipeline {

    private final double tolerance;
    private final boolean collapseSingleChild;
    private final DiagnosticsSink diagnostics;

    public TreemapPipeline(TreemapConfig config, DiagnosticsSink diagnostics) {
        this(config.getTolerance(), config.isCollapseSingleChild(), diagnostics);
    }

    public TreemapPipeline(double tolerance, boolean collapseSingleChild, DiagnosticsSink diagnostics) {
        this.tolerance = tolerance;
        this.collapseSingleChild = collapseSingleChild;
        this.diagnostics = diagnostics;
    }

    public TreemapResult run(RecordSet recordSet) {
        return run(recordSet.records(), recordSet.depth());
    }

    public TreemapResult run(List<HierarchyRecord> records, int depth) {
        AggregateTree tree = new AggregateTreeBuilder(tolerance).build(records);
        diagnostics.aggregateTree(tree);

        int analyzedDepth = Math.max(depth, tree.depth());
        SingleStepSet singleSteps = collapseSingleChild
                ? new SingleStepAnalyzer().analyze(tree.leafPaths(), analyzedDepth)
                : SingleStepSet.EMPTY;
        diagnostics.singleSteps(singleSteps);

        StructuralPathRewriter rewriter = new StructuralPathRewriter(singleSteps, collapseSingleChild);
        TreemapResult result = new TreemapResult(tree, singleSteps,
                rewriter.describeLeaves(tree), rewriter.interiorValues(tree));
        diagnostics.leaves(result);
        return result;
    }
}
