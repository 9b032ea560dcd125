package SFC.Model;

/**
 * Worklist entry: a state to expand, its identifier and its distance from the start.
 */
public record ExplorationRecord<S>(S state, int id, int depth) {

  @Override
  public String toString() {
    return id + "@" + depth + ": " + state;
  }
}
