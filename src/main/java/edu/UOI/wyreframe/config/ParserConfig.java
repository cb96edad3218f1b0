package edu.UOI.wyreframe.config;

import fixer.Fixer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import parser.WireframeParser;

@Configuration
public class ParserConfig {

    @Bean
    public WireframeParser wireframeParser(WyreframeProperties props) {
        return new WireframeParser(props.getMaxNestingDepth());
    }

    @Bean
    public Fixer fixer(WireframeParser parser, WyreframeProperties props) {
        return new Fixer(parser, props.getMaxFixIterations());
    }
}
