package worldsim.simulation;

public record ResourceDelta(String resource, double before, double after) {

    public double delta() {
        return after - before;
    }
}
