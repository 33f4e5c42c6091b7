package org.rostilos.reviewpilot.analysisengine.pipeline;

import org.rostilos.reviewpilot.analysisengine.llm.ModelConfig;
import org.rostilos.reviewpilot.analysisengine.parser.CriticalItem;
import org.rostilos.reviewpilot.analysisengine.parser.SeverityCounts;
import org.rostilos.reviewpilot.core.model.review.ReviewRun;
import org.rostilos.reviewpilot.vcsclient.model.ChangeDiff;
import org.rostilos.reviewpilot.vcsclient.model.ChangeMetadata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Working state of one pipeline run.
 * <p>
 * Scalar fields are overwritten by the stage that produces them. Review results only ever
 * accumulate: {@link #addResult(FileReviewResult)} appends the result, its critical items and
 * its response and prompt under the file key. The position in the file loop is owned by
 * {@link ReviewPipeline#run(Long)} and is not kept here.
 */
public class ReviewState {

    public static final String BATCH_REVIEW_KEY = "batch_review";

    private final Long runId;

    private ReviewRun run;
    private ChangeMetadata metadata;
    private ModelConfig modelConfig;
    private String systemPrompt;
    private List<ChangeDiff> diffs = List.of();
    private String summary = "";
    private boolean batchMode;
    private String batchResponse;

    private final List<FileReviewResult> fileResults = new ArrayList<>();
    private final List<CriticalItem> criticalItems = new ArrayList<>();
    private final Map<String, String> responsesByFile = new LinkedHashMap<>();
    private final Map<String, String> promptsByFile = new LinkedHashMap<>();

    public ReviewState(Long runId) {
        this.runId = runId;
    }

    public void addResult(FileReviewResult result) {
        fileResults.add(result);
        for (CriticalItem item : result.criticalItems()) {
            criticalItems.add(item.withDefaultPath(result.filePath()));
        }
        responsesByFile.put(result.filePath(), result.response());
        promptsByFile.put(result.filePath(), result.prompt());
    }

    public SeverityCounts totalCounts() {
        SeverityCounts total = SeverityCounts.ZERO;
        for (FileReviewResult result : fileResults) {
            total = total.plus(result.counts());
        }
        return total;
    }

    public int fileCount() {
        return diffs.size();
    }

    /**
     * Title of the change, preferring freshly fetched metadata over the stored run.
     */
    public String title() {
        if (metadata != null && metadata.title() != null) {
            return metadata.title();
        }
        return run != null ? run.getTitle() : null;
    }

    public String description() {
        if (metadata != null && metadata.description() != null) {
            return metadata.description();
        }
        return run != null ? run.getDescription() : null;
    }

    public Long getRunId() {
        return runId;
    }

    public ReviewRun getRun() {
        return run;
    }

    public void setRun(ReviewRun run) {
        this.run = run;
    }

    public ChangeMetadata getMetadata() {
        return metadata;
    }

    public void setMetadata(ChangeMetadata metadata) {
        this.metadata = metadata;
    }

    public ModelConfig getModelConfig() {
        return modelConfig;
    }

    public void setModelConfig(ModelConfig modelConfig) {
        this.modelConfig = modelConfig;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }

    public List<ChangeDiff> getDiffs() {
        return diffs;
    }

    public void setDiffs(List<ChangeDiff> diffs) {
        this.diffs = List.copyOf(diffs);
    }

    public String getSummary() {
        return summary;
    }

    public void setSummary(String summary) {
        this.summary = summary;
    }

    public boolean isBatchMode() {
        return batchMode;
    }

    public void setBatchMode(boolean batchMode) {
        this.batchMode = batchMode;
    }

    public String getBatchResponse() {
        return batchResponse;
    }

    public void setBatchResponse(String batchResponse) {
        this.batchResponse = batchResponse;
    }

    public List<FileReviewResult> getFileResults() {
        return Collections.unmodifiableList(fileResults);
    }

    public List<CriticalItem> getCriticalItems() {
        return Collections.unmodifiableList(criticalItems);
    }

    public Map<String, String> getResponsesByFile() {
        return Collections.unmodifiableMap(responsesByFile);
    }

    public Map<String, String> getPromptsByFile() {
        return Collections.unmodifiableMap(promptsByFile);
    }
}
