package com.cliffc.dce.type;

import java.util.HashMap;

// Inferred node types, as a set-of-values lattice.  The bottom is NONE, the
// empty set: a node typed NONE can never produce a value at runtime.  The top
// is ALL: no knowledge at all.  Control and effect are their own points,
// unrelated to the value types.
//
// All Types are interned, so equality is pointer-equality.
public class Type {
  static private int CNT=1;
  final int _uid=CNT++; // Unique ID, will have gaps, used to uniquely order Types
  byte _type;           // Simple types use a simple enum

  protected Type(byte type) { _type=type; }
  @Override public int hashCode( ) { return _type; }
  // Is anything equals to this?
  @Override public boolean equals( Object o ) {
    assert is_simple();         // Overridden in subclasses
    if( this == o ) return true;
    return (o instanceof Type t) && _type==t._type;
  }
  @Override public String toString() { return STRS[_type]; }

  // Hash-Cons - all Types are interned in this hash table.  Thus an equality
  // check of a Type is always a simple pointer-equality check, except during
  // construction and intern'ing.
  private static final HashMap<Type,Type> INTERN = new HashMap<>();
  Type hashcons() {
    Type t2 = INTERN.get(this); // Lookup
    if( t2!=null ) return t2;   // Found prior
    INTERN.put(this,this);      // Put in table
    return this;
  }
  static Type make( byte type ) { return new Type(type).hashcons(); }

  static final byte TNONE  = 0; // Uninhabited; no values
  static final byte TCTRL  = 1; // Control
  static final byte TEFFECT= 2; // Effect chain
  static final byte TALL   = 3; // Any value at all
  static final byte TSIMPLE= 4; // End of the simple types
  static final byte TINT   = 5; // All Integers; see TypeInt
  static final String[] STRS = new String[]{"None","Ctrl","Effect","All"};

  public static final Type NONE  = make(TNONE );
  public static final Type CTRL  = make(TCTRL );
  public static final Type EFFECT= make(TEFFECT);
  public static final Type ALL   = make(TALL  );

  // True if this is a simple non-parameterized type
  boolean is_simple() { return _type < TSIMPLE; }

  // True if some runtime value can have this type
  public boolean isInhabited() { return this != NONE; }

  // Union: the smallest type holding every value of either.  NONE is the
  // identity, ALL absorbs value types.  Mixing control or effect with
  // anything else falls to ALL.
  public final Type union( Type t ) {
    if( this==t || t==NONE ) return this;
    if( this==NONE ) return t;
    if( this==ALL || t==ALL ) return ALL;
    if( _type == t._type && !is_simple() ) return xunion(t);
    return ALL;
  }
  // Subclasses union with same-class types
  Type xunion( Type t ) { throw new IllegalStateException("xunion on "+this); }

  // Intersect: the values common to both.  Disjoint types intersect to NONE.
  public final Type intersect( Type t ) {
    if( this==t || t==ALL ) return this;
    if( this==ALL ) return t;
    if( this==NONE || t==NONE ) return NONE;
    if( _type == t._type && !is_simple() ) return xintersect(t);
    return NONE;
  }
  Type xintersect( Type t ) { throw new IllegalStateException("xintersect on "+this); }

  // Subset: every value of this is also a value of t
  public boolean is( Type t ) { return union(t)==t; }
}
