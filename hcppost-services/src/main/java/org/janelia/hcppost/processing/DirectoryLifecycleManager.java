package org.janelia.hcppost.processing;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import com.google.common.collect.ImmutableList;
import jakarta.inject.Inject;

import org.janelia.hcppost.model.SeriesRecord;
import org.janelia.hcppost.model.SubjectLayout;
import org.janelia.hcppost.processing.exceptions.DirectoryCreationException;
import org.janelia.hcppost.utils.FileUtils;
import org.slf4j.Logger;

/**
 * Resets the output directories of a subject: whatever a previous run left in them is removed and the directories
 * are recreated empty.
 */
public class DirectoryLifecycleManager {

    private final Logger logger;

    @Inject
    public DirectoryLifecycleManager(Logger logger) {
        this.logger = logger;
    }

    public List<Path> prepare(SubjectLayout layout, List<SeriesRecord> series) {
        ImmutableList.Builder<Path> managedDirsBuilder = ImmutableList.builder();
        SubjectLayout.ANALYSES_SUBDIRS.forEach(subdir -> managedDirsBuilder.add(layout.getAnalysesSubdir(subdir)));
        managedDirsBuilder.add(layout.getSummaryDir());
        series.forEach(s -> managedDirsBuilder.add(s.getWorkingDir()));
        List<Path> managedDirs = managedDirsBuilder.build();

        logger.info("Removing existing outputs from {}", layout.getSubjectRoot());
        for (Path dir : managedDirs) {
            try {
                FileUtils.deletePath(dir);
            } catch (IOException e) {
                throw new DirectoryCreationException("Unable to remove previous output directory " + dir, e);
            }
        }
        for (Path dir : managedDirs) {
            try {
                FileUtils.createGroupWritableDirs(dir);
            } catch (IOException e) {
                throw new DirectoryCreationException("Unable to create output directory " + dir, e);
            }
        }
        logger.debug("Created output directories {}", managedDirs);
        return managedDirs;
    }
}
