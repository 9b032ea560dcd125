package SFC.Model;

/**
 * Parameters of a containment check, passed explicitly so concurrent checks never share settings.
 */
public record CheckOptions(
    ExplorationBudget budget,
    ObservationPolicy observation,
    ImplicationDomain implicationDomain,
    Direction direction,
    boolean parallel
) {
    public CheckOptions {
        if (budget == null || observation == null || implicationDomain == null || direction == null) {
            throw new IllegalArgumentException("CheckOptions fields must not be null");
        }
    }

    public static CheckOptions defaults() {
        return new CheckOptions(ExplorationBudget.defaults(), ObservationPolicy.inferred(),
            ImplicationDomain.defaults(), Direction.CONTAINMENT, true);
    }

    public CheckOptions withBudget(ExplorationBudget budget) {
        return new CheckOptions(budget, observation, implicationDomain, direction, parallel);
    }

    public CheckOptions withObservation(ObservationPolicy observation) {
        return new CheckOptions(budget, observation, implicationDomain, direction, parallel);
    }

    public CheckOptions withImplicationDomain(ImplicationDomain implicationDomain) {
        return new CheckOptions(budget, observation, implicationDomain, direction, parallel);
    }

    public CheckOptions withDirection(Direction direction) {
        return new CheckOptions(budget, observation, implicationDomain, direction, parallel);
    }

    public CheckOptions withParallel(boolean parallel) {
        return new CheckOptions(budget, observation, implicationDomain, direction, parallel);
    }
}
