package com.qualitylens.core.principle;

import com.qualitylens.core.config.AnalyzerConfig;
import com.qualitylens.core.extract.ContainerExtractor;
import com.qualitylens.core.extract.ImportExtractor;
import com.qualitylens.core.extract.SourceText;
import com.qualitylens.core.extract.StructuralExtractor;
import com.qualitylens.core.i18n.Messages;
import com.qualitylens.core.i18n.ResourceBundleMessages;
import com.qualitylens.core.model.SourceContainer;
import com.qualitylens.core.model.SourceUnit;
import com.qualitylens.core.util.Deadline;
import com.qualitylens.core.util.Languages;

import java.util.List;

/**
 * Base class for principle checker tests.
 *
 * <p>Builds a {@link PrincipleContext} from inline source with the production extractors,
 * exactly as the analysis engine does for a project run.
 */
public abstract class PrincipleTestBase {

    protected final Messages messages = ResourceBundleMessages.loadDefault();

    protected PrincipleContext context(String fileName, String content) {
        return context(fileName, content, AnalyzerConfig.defaults());
    }

    protected PrincipleContext context(String fileName, String content, AnalyzerConfig config) {
        SourceText source = SourceText.of(content);
        List<SourceUnit> units = new StructuralExtractor(config.limits()).extract(source, Deadline.none());
        List<SourceContainer> containers = new ContainerExtractor(config.limits())
            .extract(fileName, source, units, Deadline.none());
        List<String> imports = new ImportExtractor(config.limits()).extract(source);
        return new PrincipleContext(fileName, Languages.JAVASCRIPT, source, units, containers, imports,
            config, messages, Deadline.none());
    }
}
