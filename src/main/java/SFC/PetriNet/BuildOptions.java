package SFC.PetriNet;

/**
 * @param serializeActions - route every chart transition through an auxiliary place, so that
 *                         the guard fires first and the action afterwards
 */
public record BuildOptions(boolean serializeActions) {

    public static BuildOptions defaults() {
        return new BuildOptions(false);
    }

    public static BuildOptions serialized() {
        return new BuildOptions(true);
    }
}
