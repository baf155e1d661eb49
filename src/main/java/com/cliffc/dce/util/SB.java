package com.cliffc.dce.util;

/** Tight/tiny StringBuilder wrapper.
 *  Short short names on purpose; so they don't obscure the printing. */
public final class SB {
  public final StringBuilder _sb;
  public SB(        ) { _sb = new StringBuilder( ); }
  public SB p( String s ) { _sb.append(s); return this; }
  public SB p( char   s ) { _sb.append(s); return this; }
  public SB p( int    s ) { _sb.append(s); return this; }
  public SB p( long   s ) { _sb.append(s); return this; }
  public SB p( boolean s) { _sb.append(s); return this; }
  public SB nl( ) { return p('\n'); }

  @Override public String toString() { return _sb.toString(); }
}
