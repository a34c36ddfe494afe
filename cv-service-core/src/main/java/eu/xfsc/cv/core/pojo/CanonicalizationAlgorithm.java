package eu.xfsc.cv.core.pojo;

/**
 * RDF dataset canonicalization algorithms the normalizer can be asked for.
 * {@link #DEFAULT} leaves the choice to the normalizer implementation.
 */
public enum CanonicalizationAlgorithm {
  URGNA2012,
  URDNA2015,
  DEFAULT
}
