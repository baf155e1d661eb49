package com.cliffc.dce.node;

import com.cliffc.dce.util.SB;

/** The kind of a node plus the shape of its inputs and outputs.
 *
 *  Operators are immutable and shared between nodes.  A node whose arity or
 *  kind changes swaps in a whole new Operator.  Inputs are always laid out
 *  values first, then effects, then controls.
 */
public final class Operator {
  public final Op _op;
  public final int _vin, _ein, _cin;    // Input counts: value, effect, control
  public final int _vout, _eout, _cout; // Output counts: value, effect, control
  public final Rep _rep;                // Phi representation, else null
  public final int _con;                // Constant, or IfValue case value
  public final int _aux;                // Parameter index, or IfValue comparison order

  Operator( Op op, int vin, int ein, int cin, int vout, int eout, int cout ) {
    this(op,vin,ein,cin,vout,eout,cout,null,0,0);
  }
  Operator( Op op, int vin, int ein, int cin, int vout, int eout, int cout, Rep rep, int con, int aux ) {
    assert vin>=0 && ein>=0 && cin>=0;
    _op=op;
    _vin=vin;  _ein=ein;  _cin=cin;
    _vout=vout; _eout=eout; _cout=cout;
    _rep=rep; _con=con; _aux=aux;
  }

  public int inputCount() { return _vin+_ein+_cin; }
  // First index of each input segment
  public int effectStart () { return _vin; }
  public int controlStart() { return _vin+_ein; }

  @Override public String toString() {
    SB sb = new SB().p(_op._name);
    switch( _op ) {
    case PHI -> sb.p('[').p(_rep.name()).p(',').p(_vin).p(']');
    case EFFECT_PHI -> sb.p('[').p(_ein).p(']');
    case MERGE, LOOP, END -> sb.p('[').p(_cin).p(']');
    case INT32_CONSTANT -> sb.p('[').p(_con).p(']');
    case PARAMETER -> sb.p('[').p(_aux).p(']');
    case IF_VALUE -> sb.p('[').p(_con).p(',').p(_aux).p(']');
    case SWITCH -> sb.p('[').p(_cout).p(']');
    default -> { }
    }
    return sb.toString();
  }
}
