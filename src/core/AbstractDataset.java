package core;

/**
 *
 * Named dataset.
 */
public abstract class AbstractDataset extends AbstractRunner {

    protected final String name;

    public AbstractDataset(String name) {
        this.name = name;
    }

    public String getName() {
        return this.name;
    }

    /**
     * Number of observations.
     */
    public abstract int size();
}
