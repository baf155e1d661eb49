package com.cliffc.dce.node;

// Machine representation of a value, carried by Phis.
public enum Rep {
  NONE,                         // Void; a Phi of nothing
  BIT,
  WORD32,
  WORD64,
  FLOAT64,
  TAGGED
}
