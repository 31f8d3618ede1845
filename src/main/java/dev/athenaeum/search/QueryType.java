package dev.athenaeum.search;

/**
 * Advisory classification of a query, used only to pick fusion weights. Both retrieval branches
 * run regardless of the type.
 */
public enum QueryType {
  /** Exact phrase or very short lookup; favours lexical scoring. */
  FACTUAL,
  /** Question form or long free text; favours semantic scoring. */
  CONCEPTUAL,
  /** Neither of the above. */
  MIXED
}
