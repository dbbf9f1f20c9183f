package com.qualitylens.core.metric;

import com.qualitylens.core.config.AnalyzerConfig;
import com.qualitylens.core.extract.SourceText;
import com.qualitylens.core.extract.StructuralExtractor;
import com.qualitylens.core.i18n.ResourceBundleMessages;
import com.qualitylens.core.model.Finding;
import com.qualitylens.core.util.Deadline;

import java.util.List;

/**
 * Base class for metric calculator tests.
 *
 * <p>Extracts units from inline source with the production extractor and runs the
 * calculator under test with the default message bundle.
 */
public abstract class MetricTestBase {

    protected abstract MetricCalculator calculator();

    protected List<Finding> calculate(String content) {
        return calculate(AnalyzerConfig.defaults(), content);
    }

    protected List<Finding> calculate(AnalyzerConfig config, String content) {
        SourceText source = SourceText.of(content);
        StructuralExtractor extractor = new StructuralExtractor(config.limits());
        MetricContext context = new MetricContext("test.js", source, extractor.extract(source, Deadline.none()),
            config, ResourceBundleMessages.loadDefault(), Deadline.none());
        return calculator().calculate(context);
    }

    /**
     * Builds a function whose body repeats a statement.
     *
     * @param name function name
     * @param statement statement placed on each body line
     * @param times number of body lines
     * @return source text
     */
    protected static String function(String name, String statement, int times) {
        StringBuilder builder = new StringBuilder("function ").append(name).append("(x) {\n");
        for (int i = 0; i < times; i++) {
            builder.append("  ").append(statement).append('\n');
        }
        return builder.append("}\n").toString();
    }
}
