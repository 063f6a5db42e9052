package io.b2mash.b2b.accessaudit.job;

/** Which account a job runs as on each asset. */
public enum RunasPolicy {
  /** Only the asset's privileged account; assets without one are skipped. */
  PRIVILEGED_ONLY,
  /** The privileged account if there is one, else the named {@code runas} account. */
  PRIVILEGED_FIRST,
  /** Always the named account; assets without it are skipped. */
  SKIP
}
