package org.janelia.hcppost.app;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import jakarta.enterprise.inject.se.SeContainer;
import jakarta.enterprise.inject.se.SeContainerInitializer;
import jakarta.inject.Inject;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.StringUtils;
import org.janelia.hcppost.cdi.ApplicationConfigProvider;
import org.janelia.hcppost.model.FinalOutputReport;
import org.janelia.hcppost.processing.SubjectPostProcessor;
import org.janelia.hcppost.processing.common.ComputationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point: post-processes a single subject or every subject of a batch manifest.
 */
public class PostProcessApp {

    private static final Logger LOG = LoggerFactory.getLogger(PostProcessApp.class);

    static final int SUCCESS = 0;
    static final int FAILURE = 1;

    private final SubjectPostProcessor subjectPostProcessor;
    private final BatchManifestReader batchManifestReader;

    @Inject
    public PostProcessApp(SubjectPostProcessor subjectPostProcessor, BatchManifestReader batchManifestReader) {
        this.subjectPostProcessor = subjectPostProcessor;
        this.batchManifestReader = batchManifestReader;
    }

    public static void main(String[] args) {
        AppArgs appArgs = new AppArgs();
        JCommander cmdline = JCommander.newBuilder().addObject(appArgs).build();
        try {
            cmdline.parse(args);
        } catch (ParameterException e) {
            LOG.error("Invalid arguments: {}", e.getMessage());
            displayAppUsage(cmdline);
            System.exit(FAILURE);
            return;
        }
        if (appArgs.displayUsage) {
            displayAppUsage(cmdline);
            return;
        }
        int exitCode;
        ApplicationConfigProvider.applicationArgs().putAll(appArgs.appDynamicConfig);
        try (SeContainer container = SeContainerInitializer.newInstance().initialize()) {
            PostProcessApp app = container.select(PostProcessApp.class).get();
            exitCode = app.run(appArgs);
        } catch (Throwable e) {
            LOG.error("Error running post-processing", e);
            exitCode = FAILURE;
        }
        System.exit(exitCode);
    }

    private static void displayAppUsage(JCommander cmdline) {
        StringBuilder usage = new StringBuilder();
        cmdline.getUsageFormatter().usage(usage);
        System.out.println(usage);
    }

    int run(AppArgs appArgs) {
        List<BatchEntry> entries;
        try {
            entries = getEntries(appArgs);
        } catch (ComputationException e) {
            LOG.error("Cannot determine the subjects to process", e);
            return FAILURE;
        }
        int nFailures = 0;
        for (BatchEntry entry : entries) {
            if (!processSubject(entry, appArgs.projectConfig)) {
                nFailures++;
            }
        }
        if (nFailures > 0) {
            LOG.error("{} of {} subjects failed", nFailures, entries.size());
            return FAILURE;
        }
        return SUCCESS;
    }

    private List<BatchEntry> getEntries(AppArgs appArgs) {
        if (StringUtils.isNotBlank(appArgs.batchList)) {
            return batchManifestReader.read(Paths.get(appArgs.batchList));
        }
        if (StringUtils.isBlank(appArgs.subjectId) || StringUtils.isBlank(appArgs.outputPath)) {
            throw new ComputationException("Both the subject ID and the output path are required when no batch list is given");
        }
        return ImmutableList.of(new BatchEntry(appArgs.subjectId, appArgs.outputPath));
    }

    /**
     * Runtime failures are logged and counted against the subject; the batch goes on with the next entry.
     */
    private boolean processSubject(BatchEntry entry, String projectConfig) {
        try {
            Path outputPath = Paths.get(entry.getOutputPath());
            FinalOutputReport report = subjectPostProcessor.process(entry.getSubjectId(), outputPath, projectConfig);
            if (!report.isComplete()) {
                LOG.warn("{} finished with missing outputs: {}", entry.getSubjectId(), report.getMissingOutputs());
            }
            return true;
        } catch (ComputationException e) {
            LOG.error("Post-processing failed for {} in {}", entry.getSubjectId(), entry.getOutputPath(), e);
            return false;
        } catch (RuntimeException e) {
            LOG.error("Unexpected error post-processing {} in {}", entry.getSubjectId(), entry.getOutputPath(), e);
            return false;
        }
    }
}
