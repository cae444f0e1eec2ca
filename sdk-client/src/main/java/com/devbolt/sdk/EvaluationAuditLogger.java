package com.devbolt.sdk;

import com.devbolt.core.model.EvaluationContext;
import com.devbolt.core.model.EvaluationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * {@code onFlagEvaluated} callback that writes one JSON line per evaluation
 * to the {@value #AUDIT_LOGGER} logger at info level.
 *
 * <pre>{@code
 * ClientOptions.builder().onFlagEvaluated(new EvaluationAuditLogger()).build();
 * }</pre>
 */
public class EvaluationAuditLogger implements BiConsumer<EvaluationResult, EvaluationContext> {

    public static final String AUDIT_LOGGER = "devbolt.audit";

    private final Logger audit;
    private final EvaluationResultSerializer serializer;

    public EvaluationAuditLogger() {
        this(LoggerFactory.getLogger(AUDIT_LOGGER), new EvaluationResultSerializer());
    }

    EvaluationAuditLogger(Logger audit, EvaluationResultSerializer serializer) {
        this.audit = Objects.requireNonNull(audit, "audit logger must not be null");
        this.serializer = Objects.requireNonNull(serializer, "serializer must not be null");
    }

    @Override
    public void accept(EvaluationResult result, EvaluationContext context) {
        if (audit.isInfoEnabled()) {
            audit.info(serializer.toJson(result));
        }
    }
}
