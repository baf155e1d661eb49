package com.cliffc.dce.type;

// Closed 32-bit integer ranges [lo,hi].  An empty range is never made, it
// folds to Type.NONE instead.
public class TypeInt extends Type {
  public final int _lo, _hi;
  private TypeInt( int lo, int hi ) { super(TINT); _lo=lo; _hi=hi; }
  @Override public int hashCode( ) { return TINT+_lo*31+_hi; }
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof TypeInt t2) ) return false;
    return _lo==t2._lo && _hi==t2._hi;
  }
  @Override public String toString() {
    if( is_con() ) return Integer.toString(_lo);
    if( this==INT32 ) return "Int32";
    return "["+_lo+".."+_hi+"]";
  }

  public static Type make( int lo, int hi ) {
    return lo > hi ? Type.NONE : new TypeInt(lo,hi).hashcons();
  }
  public static TypeInt con( int con ) { return (TypeInt)make(con,con); }

  static public final TypeInt INT32 = (TypeInt)make(Integer.MIN_VALUE,Integer.MAX_VALUE);
  static public final TypeInt BOOL  = (TypeInt)make(0,1);

  public boolean is_con() { return _lo==_hi; }

  @Override Type xunion( Type t ) {
    TypeInt ti = (TypeInt)t;
    return make(Math.min(_lo,ti._lo),Math.max(_hi,ti._hi));
  }
  @Override Type xintersect( Type t ) {
    TypeInt ti = (TypeInt)t;
    return make(Math.max(_lo,ti._lo),Math.min(_hi,ti._hi));
  }
}
