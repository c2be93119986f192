package org.carball.motif.cli;

import lombok.Data;
import org.carball.motif.config.OutputFormat;
import org.carball.motif.model.SolutionCategory;
import org.carball.motif.model.TechStack;

import java.util.ArrayList;
import java.util.List;

@Data
public class CommandOptions {

    private String command;
    private String argument;
    private SolutionCategory category;
    private TechStack techStack;
    private Double minQuality;
    private Double minRating;
    private List<String> keywords = new ArrayList<>();
    private Integer limit;
    private OutputFormat format = OutputFormat.MARKDOWN;
    private String outputFile;
}
