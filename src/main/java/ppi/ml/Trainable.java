package ppi.ml;

/**
 * One model family: knows how to turn training input into a {@link TrainedModel}.
 *
 * @param <I> training input ({@code Series} or {@code TabularDataset})
 * @param <M> the fitted model type
 */
public interface Trainable<I, M extends TrainedModel> {

    ModelFamily family();

    /** @throws ModelFitException if this family cannot be fit to {@code input} */
    M fit(I input);
}
