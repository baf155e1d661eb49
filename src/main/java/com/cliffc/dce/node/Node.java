package com.cliffc.dce.node;

import com.cliffc.dce.GraphException;
import com.cliffc.dce.type.Type;
import com.cliffc.dce.util.SB;

import java.util.Arrays;
import java.util.function.IntSupplier;

// Sea-of-Nodes
public final class Node implements IntSupplier {

  // --------------------------------------------------------------------------
  // Unique dense node-numbering, per Graph.  Never reused.
  public final int _uid;
  @Override public int getAsInt() { return _uid; }

  // The node kind and input partitioning.  Changed wholesale by setOp.
  Operator _op;
  public Operator op() { return _op; }
  public Op opcode() { return _op._op; }

  // Inferred type, or null if never typed.
  Type _type;
  // The type, defaulting to ALL when untyped.
  public Type type() { return _type==null ? Type.ALL : _type; }
  public Node setType( Type t ) { _type = t; return this; }

  Node( int uid, Operator op, Node... defs ) {
    _uid  = uid;
    _op   = op;
    _defs = defs.clone();  _len = defs.length;
    for( Node def : _defs ) if( def != null ) def._addUse(this);
    _uses = new Node[1]; _ulen = 0;
  }

  // --------------------------------------------------------------------------
  // Node pretty-print info

  // {@code toString} is what you get in the debugger.  It has to print 1
  // line (because this is what a debugger typically displays by default) and
  // has to be robust with broken graph/nodes.
  @Override public String toString() { return "#"+_uid+":"+_op; }

  // Print a node on 1 line, columnar aligned, as:
  // NNID NNAME DDEF DDEF  [[  UUSE UUSE  ]]  TYPE
  // 1234 sssss 1234 1234 1234 1234 1234 1234 tttttt
  public SB _printLine( SB sb ) {
    sb.p("%4d %-14.14s ".formatted(_uid,_op.toString()));
    if( isDead() ) return sb.p("DEAD\n");
    for( int i=0; i<_len; i++ ) {
      Node def = _defs[i];
      sb.p(def==null ? "____ " : "%4d ".formatted(def._uid));
    }
    for( int i = _len; i<3; i++ ) sb.p("     ");
    sb.p(" [[  ");
    for( int i=0; i<_ulen; i++ ) {
      Node use = _uses[i];
      sb.p(use==null ? "____ " : "%4d ".formatted(use._uid));
    }
    int lim = 6 - Math.max(_len,4);
    for( int i = _ulen; i<lim; i++ )
      sb.p("     ");
    sb.p(" ]]  ");
    if( _type!= null ) sb.p(_type.toString());
    return sb.p("\n");
  }

  // --------------------------------------------------------------------------
  // Primitive edge management.  Add and remove edges in a single direction.

  // Defs.  Fixed length per operator, ordered: values, effects, controls.
  private Node[] _defs;         // Array of defs
  private int _len;             // The in-use part of defs
  public int len() { return _len; }
  public Node in( int i) { assert i<_len; return _defs[i]; }
  public Node last() { return _defs[_len-1]; }

  // Snapshot of the defs; safe to walk while editing
  public Node[] defs() { return Arrays.copyOf(_defs,_len); }

  // Add a def, making more space as needed.
  private void _addDef( Node n ) {
    if( _len == _defs.length )
      _defs = Arrays.copyOf(_defs,Math.max(1,_len<<1));
    _defs[_len++] = n;
  }

  // Return the def index or -1
  public int findDef( Node def ) {
    for( int i=0; i<_len; i++ )  if( _defs[i]==def )  return i;
    return -1;
  }

  // Uses.  Variable length, unordered, one entry per use edge.
  private Node[] _uses;         // Array of uses
  private int _ulen;            // The in-use part of uses

  public int nUses() { return _ulen; }
  // Snapshot of the uses; safe to walk while editing
  public Node[] uses() { return Arrays.copyOf(_uses,_ulen); }

  // Add a use, making more space as needed.
  private void _addUse( Node n ) {
    // A NPE here means the _uses are null, which means the Node was killed
    if( _ulen == _uses.length )
      _uses = Arrays.copyOf(_uses,Math.max(1,_ulen<<1));
    _uses[_ulen++] = n;
  }

  // Delete a use, which must exist.
  private void _delUse( Node n ) {
    // NPE here if 'this' is dead
    int idx = findUse(n);
    // AIOOBE here if 'n' was not found
    _uses[idx] = _uses[--_ulen];
    _uses[_ulen] = null;
  }

  // Find use.  Backwards scan, because most recent found was probably also
  // most recently added.
  public int findUse( Node use ) {
    for( int i=_ulen-1; i>=0; i-- )  if( _uses[i]==use )  return i;
    return -1;
  }
  // Count of edges from 'use' into this
  public int countUse( Node use ) {
    int cnt=0;
    for( int i=0; i<_ulen; i++ )  if( _uses[i]==use )  cnt++;
    return cnt;
  }

  public boolean isDead() { return _uses == null; }

  // --------------------------------------------------------------------------
  // Bi-directional edge management.

  // Add def/use edge.  Updates both sides of the graph.
  public Node addDef(Node n) {
    _addDef(n);
    if( n!=null ) n._addUse(this);
    return this;
  }

  // Replace def/use edge.  Updates both sides of the graph.  The old def
  // loses a use but is not killed; unreferenced nodes simply fall out of the
  // graph.  Returns 'this'.
  public Node setDef( int idx, Node n ) {
    Node old = in(idx);         // Get old value
    if( old == n ) return this;
    // Add edge to new guy before deleting old
    if( (_defs[idx] = n) != null ) n._addUse(this);
    if( old != null ) old._delUse(this);
    return this;
  }

  // Drop all defs past 'len', preserving order of the rest.
  public Node trimInputCount( int len ) {
    assert len <= _len;
    while( _len > len ) {
      Node n = _defs[--_len];
      _defs[_len] = null;
      if( n != null ) n._delUse(this);
    }
    return this;
  }

  // Swap in a new operator.  The inputs must already match its shape.
  public Node setOp( Operator op ) {
    if( op.inputCount() != _len )
      throw new GraphException(this,"Operator "+op+" wants "+op.inputCount()+" inputs, node has "+_len);
    _op = op;
    return this;
  }

  // Does graph-structure changes, making pointers-to-this point to nnn.
  // Changes neither 'this' nor 'nnn' otherwise.
  public void replaceUses( Node nnn ) {
    assert nnn != this && !nnn.isDead();
    while( _ulen > 0 ) {
      Node u = _uses[--_ulen];  // Old use
      _uses[_ulen] = null;
      u._defs[u.findDef(this)] = nnn; // was this now nnn
      nnn._addUse(u);
    }
  }

  // Kill an unused node; all inputs are null'd out and it reads as dead.
  // Inputs are not recursively killed.
  public Node kill( ) {
    if( isDead() ) return this;
    assert _ulen==0 : "killing used node "+this;
    while( _len > 0 ) {
      Node n = _defs[--_len];
      if( n != null ) n._delUse(this);
    }
    _defs = _uses = null;       // Poor-man's indication of a dead node
    return this;
  }

  // --------------------------------------------------------------------------
  // Segmented inputs: values, then effects, then controls.

  public Node valueInput  ( int i ) { assert i < _op._vin; return in(i); }
  public Node effectInput ( int i ) { assert i < _op._ein; return in(_op.effectStart ()+i); }
  public Node controlInput( int i ) { assert i < _op._cin; return in(_op.controlStart()+i); }
  public Node effectInput () { return effectInput (0); }
  public Node controlInput() { return controlInput(0); }

  public boolean isValueEdge  ( int idx ) { return idx < _op._vin; }
  public boolean isEffectEdge ( int idx ) { return _op._vin <= idx && idx < _op.controlStart(); }
  public boolean isControlEdge( int idx ) { return _op.controlStart() <= idx && idx < _op.inputCount(); }
}
