package dev.athenaeum.search;

/**
 * Weights applied to the normalised semantic and lexical scores during fusion.
 *
 * @param semantic weight of the semantic component, in [0, 1]
 * @param lexical weight of the lexical component, in [0, 1]
 */
public record FusionWeights(double semantic, double lexical) {

  public FusionWeights {
    if (semantic < 0.0 || semantic > 1.0 || lexical < 0.0 || lexical > 1.0) {
      throw new IllegalArgumentException(
          "Fusion weights must be in [0.0, 1.0], got semantic="
              + semantic
              + ", lexical="
              + lexical);
    }
  }
}
