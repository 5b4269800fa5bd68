package ch.xavier.retirementsim.returns;

import java.util.PrimitiveIterator;
import java.util.stream.DoubleStream;

/**
 * Finite, lazily computed sequence of annual growth factors ({@code 1 + rate}). A generator cannot be rewound:
 * build a new one from the factory to replay a sequence.
 */
public interface ReturnGenerator extends PrimitiveIterator.OfDouble {

    /**
     * Total number of factors this generator yields.
     */
    int horizon();

    /**
     * Consumes the remaining factors into an array.
     */
    default double[] drain() {
        DoubleStream.Builder factors = DoubleStream.builder();
        forEachRemaining((double factor) -> factors.add(factor));
        return factors.build().toArray();
    }
}
