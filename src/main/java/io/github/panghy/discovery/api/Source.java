package io.github.panghy.discovery.api;

/** Where a library item's media lives. */
public enum Source {
  /** Streamed from a remote provider (imported playlist or subscription). */
  REMOTE,
  /** A file on the local disk. */
  LOCAL
}
