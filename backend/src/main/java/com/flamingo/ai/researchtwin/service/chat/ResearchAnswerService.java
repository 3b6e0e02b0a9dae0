package com.flamingo.ai.researchtwin.service.chat;

import com.flamingo.ai.researchtwin.config.RagConfig;
import com.flamingo.ai.researchtwin.domain.model.CorpusSnapshot;
import com.flamingo.ai.researchtwin.service.rag.evidence.ContractResult;
import com.flamingo.ai.researchtwin.service.rag.evidence.EvidenceContractEnforcer;
import com.flamingo.ai.researchtwin.service.rag.evidence.EvidenceReference;
import com.flamingo.ai.researchtwin.service.rag.evidence.EvidenceReferenceBuilder;
import com.flamingo.ai.researchtwin.service.rag.retrieval.RetrievalEngine;
import com.flamingo.ai.researchtwin.service.rag.retrieval.RetrievalResult;
import com.flamingo.ai.researchtwin.store.CorpusStore;
import io.micrometer.core.annotation.Timed;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Answers a question from a namespace's corpus: retrieve, bind markers, prompt the model, parse
 * the completion and enforce the evidence contract. Citations in the model output are discarded
 * in favor of the ones built from the retrieved evidence.
 */
@Service
@Slf4j
public class ResearchAnswerService {

  private final RetrievalEngine retrievalEngine;
  private final CorpusStore corpusStore;
  private final EvidenceReferenceBuilder referenceBuilder;
  private final PromptComposer promptComposer;
  private final ResearchTwinAgentClient agentClient;
  private final AgentResponseParser responseParser;
  private final EvidenceContractEnforcer contractEnforcer;
  private final RagConfig ragConfig;
  private final Clock clock;

  @Autowired
  public ResearchAnswerService(
      RetrievalEngine retrievalEngine,
      CorpusStore corpusStore,
      EvidenceReferenceBuilder referenceBuilder,
      PromptComposer promptComposer,
      ResearchTwinAgentClient agentClient,
      AgentResponseParser responseParser,
      EvidenceContractEnforcer contractEnforcer,
      RagConfig ragConfig) {
    this(
        retrievalEngine,
        corpusStore,
        referenceBuilder,
        promptComposer,
        agentClient,
        responseParser,
        contractEnforcer,
        ragConfig,
        Clock.systemUTC());
  }

  ResearchAnswerService(
      RetrievalEngine retrievalEngine,
      CorpusStore corpusStore,
      EvidenceReferenceBuilder referenceBuilder,
      PromptComposer promptComposer,
      ResearchTwinAgentClient agentClient,
      AgentResponseParser responseParser,
      EvidenceContractEnforcer contractEnforcer,
      RagConfig ragConfig,
      Clock clock) {
    this.retrievalEngine = retrievalEngine;
    this.corpusStore = corpusStore;
    this.referenceBuilder = referenceBuilder;
    this.promptComposer = promptComposer;
    this.agentClient = agentClient;
    this.responseParser = responseParser;
    this.contractEnforcer = contractEnforcer;
    this.ragConfig = ragConfig;
    this.clock = clock;
  }

  /**
   * Answers a question.
   *
   * @param request namespace, question and evidence budget
   * @return the evidence-bound answer
   * @throws IllegalArgumentException if the question is blank
   * @throws com.flamingo.ai.researchtwin.exception.LlmServiceException if the model fails
   */
  @Timed(value = "chat.answer", description = "Time to answer a question end to end")
  public AnswerResponse answer(AnswerRequest request) {
    if (request == null || request.message() == null || request.message().isBlank()) {
      throw new IllegalArgumentException("Question must not be blank");
    }
    String namespaceId =
        request.namespaceId() == null || request.namespaceId().isBlank()
            ? ragConfig.getAgent().getDefaultNamespace()
            : request.namespaceId();

    CorpusSnapshot snapshot = corpusStore.read(namespaceId);
    RetrievalResult retrieval =
        retrievalEngine.retrieveForQuery(namespaceId, request.message(), request.topK(), snapshot);
    List<EvidenceReference> references =
        referenceBuilder.build(retrieval.chunks(), snapshot.visibleDocuments());

    String prompt = promptComposer.compose(request.message(), retrieval, references);
    String completion = agentClient.complete(prompt);
    ParsedAnswer parsed = responseParser.parse(completion);

    ContractResult enforced =
        contractEnforcer.enforce(request.message(), retrieval, parsed.responseText(), references);
    log.info(
        "Answered question in namespace {} (intent={}, evidence={}, stripped markers={})",
        namespaceId,
        retrieval.intent().getValue(),
        references.size(),
        enforced.strippedMarkers());

    return AnswerResponse.builder()
        .responseText(enforced.responseText())
        .citations(enforced.citations())
        .suggestedFollowups(parsed.suggestedFollowups())
        .intent(retrieval.intent())
        .retrievalNotes(retrieval.notes())
        .timestamp(Instant.now(clock))
        .build();
  }
}
