package org.janelia.hcppost.app;

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.Parameter;

import java.util.HashMap;
import java.util.Map;

public class AppArgs {
    @Parameter(names = {"-s", "--subject_ID"}, description = "Subject identifier")
    String subjectId;
    @Parameter(names = {"-o", "--output_path"}, description = "Subject output folder produced by the preprocessing pipeline")
    String outputPath;
    @Parameter(names = {"-p", "--project_config"}, description = "Study configuration to use instead of the one inferred from the output path")
    String projectConfig;
    @Parameter(names = {"-l", "--list"}, description = "CSV file with one 'subjectID,output_folder' entry per line")
    String batchList;
    @Parameter(names = "-h", description = "Display help", arity = 0, help = true)
    boolean displayUsage = false;
    @DynamicParameter(names = "-D", description = "Dynamic application parameters that could override application properties")
    Map<String, String> appDynamicConfig = new HashMap<>();
}
