package ch.so.arp.finrag.index;

import java.util.Objects;

import ch.so.arp.finrag.sparse.SparseVector;

/**
 * Query against a {@link VectorIndex}.
 *
 * @param dense  dense query vector
 * @param sparse optional sparse query vector, only used by indices that
 *               support hybrid scoring
 * @param alpha  weight of the dense score in [0, 1]; the sparse score gets
 *               {@code 1 - alpha}
 * @param topK   maximum number of matches
 * @param filter metadata filter
 */
public record IndexQuery(float[] dense, SparseVector sparse, double alpha, int topK, MetadataFilter filter) {

    public IndexQuery {
        Objects.requireNonNull(dense, "dense");
        if (alpha < 0.0d || alpha > 1.0d) {
            throw new IllegalArgumentException("alpha must be within [0, 1]: " + alpha);
        }
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive: " + topK);
        }
        filter = filter == null ? MetadataFilter.none() : filter;
    }

    public static IndexQuery dense(float[] dense, int topK, MetadataFilter filter) {
        return new IndexQuery(dense, null, 1.0d, topK, filter);
    }

    public boolean hybrid() {
        return sparse != null && alpha < 1.0d;
    }
}
