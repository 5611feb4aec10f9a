package org.janelia.hcppost.processing;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import com.google.common.collect.ImmutableList;
import jakarta.inject.Inject;

import org.janelia.hcppost.model.FinalOutputReport;
import org.janelia.hcppost.model.SubjectLayout;
import org.slf4j.Logger;

/**
 * Checks that the outputs downstream analyses depend on were produced. Missing outputs are reported, not raised.
 */
public class FinalOutputsVerifier {

    static final List<String> EXPECTED_OUTPUTS = ImmutableList.of(
            "summary/all_FD.txt",
            "summary/DVARS_and_FD_CONCA.png",
            "summary/FD_dist.png",
            "analyses_v2/timecourses/Gordon_subcortical.csv",
            "analyses_v2/timecourses/Gordon.csv",
            "analyses_v2/timecourses/Power.csv",
            "analyses_v2/timecourses/Yeo.csv",
            "analyses_v2/matlab_code/FD.mat",
            "analyses_v2/matlab_code/motion_numbers.mat",
            "analyses_v2/matlab_code/power_2014_motion.mat"
    );

    private final Logger logger;

    @Inject
    public FinalOutputsVerifier(Logger logger) {
        this.logger = logger;
    }

    public FinalOutputReport verify(SubjectLayout layout) {
        List<Path> expectedOutputs = EXPECTED_OUTPUTS.stream()
                .map(layout.getSubjectRoot()::resolve)
                .collect(Collectors.toList());
        List<Path> missingOutputs = expectedOutputs.stream()
                .filter(p -> Files.notExists(p))
                .collect(Collectors.toList());
        if (missingOutputs.isEmpty()) {
            logger.info("All expected outputs are present for {}", layout.getSubjectId());
        } else {
            missingOutputs.forEach(p -> logger.warn("Expected output {} is missing for {}", p, layout.getSubjectId()));
        }
        return new FinalOutputReport(expectedOutputs, missingOutputs);
    }
}
