package edu.UOI.wyreframe.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/** Settings under {@code wyreframe.*} in application.properties. */
@ConfigurationProperties(prefix = "wyreframe")
public class WyreframeProperties {

    // Fixer gives up after this many parse/fix rounds
    private int maxFixIterations = 100;

    // Deeper box nesting is reported as a warning
    private int maxNestingDepth = 4;

    public int getMaxFixIterations() { return maxFixIterations; }
    public void setMaxFixIterations(int maxFixIterations) { this.maxFixIterations = maxFixIterations; }

    public int getMaxNestingDepth() { return maxNestingDepth; }
    public void setMaxNestingDepth(int maxNestingDepth) { this.maxNestingDepth = maxNestingDepth; }
}
