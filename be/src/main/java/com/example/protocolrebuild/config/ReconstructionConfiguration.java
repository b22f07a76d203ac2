package com.example.protocolrebuild.config;

import com.example.protocolrebuild.assembly.SectionAssembler;
import com.example.protocolrebuild.audit.ChangeVerifier;
import com.example.protocolrebuild.document.ProtocolDocumentCodec;
import com.example.protocolrebuild.expression.ExpressionSafetyValidator;
import com.example.protocolrebuild.expression.ExpressionSanitizer;
import com.example.protocolrebuild.llm.LangChain4jRewriteOracle;
import com.example.protocolrebuild.llm.OpenRouterChatModelFactory;
import com.example.protocolrebuild.llm.RewritePromptBuilder;
import com.example.protocolrebuild.partition.SectionPartitioner;
import com.example.protocolrebuild.pipeline.ReconstructionPipeline;
import com.example.protocolrebuild.regeneration.RegenerationOrchestrator;
import com.example.protocolrebuild.regeneration.RewriteOracle;
import com.example.protocolrebuild.regeneration.SectionValidator;
import com.example.protocolrebuild.regeneration.Sleeper;
import com.example.protocolrebuild.regeneration.parse.ResponseParser;
import com.example.protocolrebuild.suggestion.SuggestionPreflight;
import com.example.protocolrebuild.validation.CrossReferenceValidator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tools.jackson.databind.json.JsonMapper;

@Configuration
public class ReconstructionConfiguration {

    @Bean
    public ProtocolDocumentCodec protocolDocumentCodec(JsonMapper jsonMapper) {
        return new ProtocolDocumentCodec(jsonMapper);
    }

    @Bean
    public ExpressionSafetyValidator expressionSafetyValidator() {
        return new ExpressionSafetyValidator(new ExpressionSanitizer());
    }

    @Bean
    public CrossReferenceValidator crossReferenceValidator(ExpressionSafetyValidator expressionSafetyValidator) {
        return new CrossReferenceValidator(expressionSafetyValidator);
    }

    @Bean
    public SectionPartitioner sectionPartitioner(ProtocolDocumentCodec codec, ReconstructionProperties properties) {
        return new SectionPartitioner(codec, properties.toSizeTable(), properties.getMaxSectionChars());
    }

    @Bean
    public RewriteOracle rewriteOracle(OpenRouterChatModelFactory chatModelFactory) {
        return new LangChain4jRewriteOracle(chatModelFactory.build(), new RewritePromptBuilder());
    }

    @Bean
    public RegenerationOrchestrator regenerationOrchestrator(
            RewriteOracle rewriteOracle,
            ProtocolDocumentCodec codec,
            ExpressionSafetyValidator expressionSafetyValidator,
            ReconstructionProperties properties) {
        return new RegenerationOrchestrator(
                rewriteOracle,
                ResponseParser.defaults(codec.jsonMapper()),
                new SectionValidator(codec, expressionSafetyValidator),
                codec,
                properties.toRetryPolicy(),
                Sleeper.THREAD,
                properties.isRegenerateUnaffectedSections());
    }

    @Bean
    public ReconstructionPipeline reconstructionPipeline(
            CrossReferenceValidator crossReferenceValidator,
            SectionPartitioner sectionPartitioner,
            ExpressionSafetyValidator expressionSafetyValidator,
            RegenerationOrchestrator regenerationOrchestrator) {
        return new ReconstructionPipeline(
                crossReferenceValidator,
                sectionPartitioner,
                new SuggestionPreflight(expressionSafetyValidator),
                regenerationOrchestrator,
                new SectionAssembler(),
                new ChangeVerifier());
    }
}
