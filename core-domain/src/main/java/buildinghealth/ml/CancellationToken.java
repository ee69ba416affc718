package buildinghealth.ml;

import buildinghealth.domain.exception.TrainingCancelledException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Señal cooperativa de cancelación para entrenamientos largos.
 * Se considera cancelado también si el hilo que entrena ha sido interrumpido.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || Thread.currentThread().isInterrupted();
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new TrainingCancelledException();
        }
    }
}
