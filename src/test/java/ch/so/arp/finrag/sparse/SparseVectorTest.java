package ch.so.arp.finrag.sparse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class SparseVectorTest {

    @Test
    void computesDotProductOverSharedIndices() {
        SparseVector left = new SparseVector(new int[] { 1, 3, 5 }, new double[] { 1.0d, 2.0d, 3.0d });
        SparseVector right = new SparseVector(new int[] { 3, 5, 7 }, new double[] { 4.0d, 5.0d, 6.0d });

        assertThat(left.dot(right)).isCloseTo(23.0d, within(1e-9));
        assertThat(right.dot(left)).isCloseTo(23.0d, within(1e-9));
    }

    @Test
    void cosineOfDisjointVectorsIsZero() {
        SparseVector left = new SparseVector(new int[] { 1 }, new double[] { 1.0d });
        SparseVector right = new SparseVector(new int[] { 2 }, new double[] { 1.0d });

        assertThat(left.cosine(right)).isZero();
        assertThat(left.cosine(left)).isCloseTo(1.0d, within(1e-9));
    }

    @Test
    void scalesWeightsOnly() {
        SparseVector vector = new SparseVector(new int[] { 2, 4 }, new double[] { 1.0d, 2.0d });

        SparseVector scaled = vector.scale(0.5d);

        assertThat(scaled.indices()).containsExactly(2, 4);
        assertThat(scaled.weights()).containsExactly(0.5d, 1.0d);
    }

    @Test
    void rejectsUnorderedIndicesAndNonPositiveWeights() {
        assertThatThrownBy(() -> new SparseVector(new int[] { 3, 1 }, new double[] { 1.0d, 1.0d }))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SparseVector(new int[] { 1, 1 }, new double[] { 1.0d, 1.0d }))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SparseVector(new int[] { 1 }, new double[] { 0.0d }))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
