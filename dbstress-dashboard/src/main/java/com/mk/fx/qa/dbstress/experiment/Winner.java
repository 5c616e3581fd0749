package com.mk.fx.qa.dbstress.experiment;

/** Outcome of comparing one metric across the two variants. Equal means are a {@link #TIE}. */
public enum Winner {
  A,
  B,
  TIE
}
