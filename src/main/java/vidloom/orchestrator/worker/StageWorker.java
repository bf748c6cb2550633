package vidloom.orchestrator.worker;

import vidloom.orchestrator.pipeline.StageContext;

/**
 * One stage implementation. A replica processes one request at a time.
 *
 * Iterative workers call {@link StageContext#checkpoint(String)} at each
 * iteration and report progress through {@link StageContext#reportProgress(int, int)}.
 *
 * @param <I> request type
 * @param <O> result type
 */
@FunctionalInterface
public interface StageWorker<I, O> {

    O process(I request, StageContext context) throws Exception;
}
