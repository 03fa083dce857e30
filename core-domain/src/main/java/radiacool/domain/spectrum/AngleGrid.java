package radiacool.domain.spectrum;

import radiacool.domain.exception.PhysicalDomainException;

/**
 * Discretización del hemisferio θ ∈ [0, π/2) con paso uniforme dθ = (π/2)/N.
 * <p>
 * Cada ángulo lleva precalculado su peso lambertiano 2π·sinθ·cosθ·dθ y su secante,
 * de modo que la misma rejilla se reutiliza en todo el barrido de temperaturas sin recálculo.
 * La suma de pesos aproxima π (ángulo sólido proyectado del hemisferio).
 */
public final class AngleGrid {

    private final double step;
    private final double[] angles;
    private final double[] weights;
    private final double[] secants;
    private final double totalWeight;

    private AngleGrid(double step, double[] angles, double[] weights, double[] secants) {
        this.step = step;
        this.angles = angles;
        this.weights = weights;
        this.secants = secants;
        double sum = 0.0;
        for (double w : weights) sum += w;
        this.totalWeight = sum;
    }

    /**
     * @param angleCount Número de muestras angulares (≥ 1).
     */
    public static AngleGrid build(int angleCount) {
        if (angleCount < 1) {
            throw new PhysicalDomainException("angleCount", "se requiere al menos un ángulo, recibido " + angleCount);
        }
        final double dTheta = (Math.PI / 2.0) / angleCount;
        double[] angles = new double[angleCount];
        double[] weights = new double[angleCount];
        double[] secants = new double[angleCount];
        for (int i = 0; i < angleCount; i++) {
            double theta = i * dTheta;
            angles[i] = theta;
            weights[i] = 2.0 * Math.PI * Math.sin(theta) * Math.cos(theta) * dTheta;
            secants[i] = 1.0 / Math.cos(theta);
        }
        return new AngleGrid(dTheta, angles, weights, secants);
    }

    public int size() {
        return angles.length;
    }

    public double getStep() {
        return step;
    }

    public double angleAt(int index) {
        return angles[index];
    }

    public double weightAt(int index) {
        return weights[index];
    }

    public double secantAt(int index) {
        return secants[index];
    }

    /**
     * Σ pesos; tiende a π al refinar la rejilla.
     */
    public double getTotalWeight() {
        return totalWeight;
    }
}
