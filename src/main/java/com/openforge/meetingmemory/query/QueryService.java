package com.openforge.meetingmemory.query;

import com.openforge.meetingmemory.CollaboratorException;
import com.openforge.meetingmemory.config.ResilientCall;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

/**
 * Query entry point: orchestrated retrieval followed by answer generation.
 *
 * The answer generator is optional. When none is configured,
 * {@link #answer} fails with ANSWER_GENERATION while {@link #retrieve}
 * keeps working.
 */
@Slf4j
@Service
public class QueryService {

    private final QueryOrchestrator orchestrator;
    private final AnswerGenerator   generator;
    private final CircuitBreaker    answerCb;
    private final Retry             answerRetry;

    public QueryService(QueryOrchestrator orchestrator,
                        @Nullable AnswerGenerator generator,
                        CircuitBreaker answerGenerationCircuitBreaker,
                        Retry answerGenerationRetry) {
        this.orchestrator = orchestrator;
        this.generator    = generator;
        this.answerCb     = answerGenerationCircuitBreaker;
        this.answerRetry  = answerGenerationRetry;
    }

    public QueryResult retrieve(String query) {
        return orchestrator.process(query);
    }

    public AnsweredQuery answer(String query) {
        if (generator == null) {
            throw new CollaboratorException(CollaboratorException.Collaborator.ANSWER_GENERATION,
                    "No AnswerGenerator is configured");
        }
        QueryResult   result  = orchestrator.process(query);
        AnswerRequest request = AnswerRequest.of(query, result);

        String answer = ResilientCall.execute(answerCb, answerRetry,
                CollaboratorException.Collaborator.ANSWER_GENERATION,
                () -> generator.generate(request));

        log.info("[Query] Answered {} query from {} chunks", result.queryType(), result.results().size());
        return new AnsweredQuery(query, result.queryType(), answer == null ? "" : answer,
                result.results(), result.iterations());
    }
}
