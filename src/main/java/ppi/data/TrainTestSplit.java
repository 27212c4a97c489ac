package ppi.data;

import java.util.List;

/** Disjoint train and test partitions of one dataset. */
public final class TrainTestSplit {

    private final TabularDataset train;
    private final TabularDataset test;

    public TrainTestSplit(TabularDataset train, TabularDataset test) {
        this.train = train;
        this.test = test;
    }

    public TabularDataset getTrain() { return train; }
    public TabularDataset getTest() { return test; }

    /** Both partitions restricted to the same predictors. */
    public TrainTestSplit select(List<String> predictors) {
        return new TrainTestSplit(train.select(predictors), test.select(predictors));
    }
}
