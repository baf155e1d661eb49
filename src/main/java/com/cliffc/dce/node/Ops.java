package com.cliffc.dce.node;

import com.cliffc.dce.GraphException;
import org.jetbrains.annotations.NotNull;

import java.util.HashMap;

/** Operator factory.  Fixed-shape operators are shared singletons; sized
 *  operators are cached per size. */
public class Ops {
  //                                          vin ein cin vout eout cout
  private final Operator _dead       = new Operator(Op.DEAD       ,0,0,0, 1,1,1);
  private final Operator _deadValue  = new Operator(Op.DEAD_VALUE ,0,0,0, 1,0,0);
  private final Operator _unreachable= new Operator(Op.UNREACHABLE,0,1,1, 1,1,0);
  private final Operator _throw      = new Operator(Op.THROW      ,0,1,1, 0,0,1);
  private final Operator _terminate  = new Operator(Op.TERMINATE  ,0,1,1, 0,0,1);
  private final Operator _deoptimize = new Operator(Op.DEOPTIMIZE ,1,1,1, 0,0,1);
  private final Operator _loopExit   = new Operator(Op.LOOP_EXIT  ,0,0,2, 0,0,1);
  private final Operator _loopExitV  = new Operator(Op.LOOP_EXIT_VALUE ,1,0,1, 1,0,0);
  private final Operator _loopExitE  = new Operator(Op.LOOP_EXIT_EFFECT,0,1,1, 0,1,0);
  private final Operator _branch     = new Operator(Op.BRANCH     ,1,0,1, 0,0,2);
  private final Operator _ifTrue     = new Operator(Op.IF_TRUE    ,0,0,1, 0,0,1);
  private final Operator _ifFalse    = new Operator(Op.IF_FALSE   ,0,0,1, 0,0,1);
  private final Operator _ifDefault  = new Operator(Op.IF_DEFAULT ,0,0,1, 0,0,1);
  private final Operator _ifSuccess  = new Operator(Op.IF_SUCCESS ,0,0,1, 0,0,1);
  private final Operator _ifException= new Operator(Op.IF_EXCEPTION,0,1,1, 1,1,1);
  private final Operator _add        = new Operator(Op.INT32_ADD  ,2,0,0, 1,0,0);
  private final Operator _lt         = new Operator(Op.INT32_LESS_THAN,2,0,0, 1,0,0);
  private final Operator _load       = new Operator(Op.LOAD       ,1,1,1, 1,1,0);
  private final Operator _store      = new Operator(Op.STORE      ,2,1,1, 0,1,0);

  // Sized operators, by op and size
  private final HashMap<Long,Operator> _sized = new HashMap<>();
  private Operator sized( Op op, int n, int vin, int ein, int cin, int vout, int eout, int cout, Rep rep ) {
    long key = ((long)op.ordinal()<<40) | ((long)(rep==null ? 0 : rep.ordinal()+1)<<32) | n;
    return _sized.computeIfAbsent(key, k -> new Operator(op,vin,ein,cin,vout,eout,cout,rep,0,0));
  }

  public Operator dead       () { return _dead;        }
  public Operator deadValue  () { return _deadValue;   }
  public Operator unreachable() { return _unreachable; }
  public Operator throwOp    () { return _throw;       }
  public Operator terminate  () { return _terminate;   }
  public Operator deoptimize () { return _deoptimize;  }
  public Operator loopExit   () { return _loopExit;    }
  public Operator loopExitValue () { return _loopExitV; }
  public Operator loopExitEffect() { return _loopExitE; }
  public Operator branch     () { return _branch;      }
  public Operator ifTrue     () { return _ifTrue;      }
  public Operator ifFalse    () { return _ifFalse;     }
  public Operator ifDefault  () { return _ifDefault;   }
  public Operator ifSuccess  () { return _ifSuccess;   }
  public Operator ifException() { return _ifException; }
  public Operator int32Add   () { return _add;         }
  public Operator int32LessThan() { return _lt;        }
  public Operator load       () { return _load;        }
  public Operator store      () { return _store;       }

  public Operator start( int nparms ) { return sized(Op.START,nparms, 0,0,0, nparms,1,1, null); }
  public Operator end  ( int n ) { return sized(Op.END  ,n, 0,0,n, 0,0,0, null); }
  public Operator merge( int n ) { return sized(Op.MERGE,n, 0,0,n, 0,0,1, null); }
  public Operator loop ( int n ) { return sized(Op.LOOP ,n, 0,0,n, 0,0,1, null); }
  public Operator phi( @NotNull Rep rep, int n ) { return sized(Op.PHI,n, n,0,1, 1,0,0, rep); }
  public Operator effectPhi( int n ) { return sized(Op.EFFECT_PHI,n, 0,n,1, 0,1,0, null); }
  public Operator ret( int nvals ) { return sized(Op.RETURN,nvals, nvals,1,1, 0,0,1, null); }
  // Switch with n successors, the last being the default
  public Operator switchOp( int n ) {
    assert n >= 2;
    return sized(Op.SWITCH,n, 1,0,1, 0,0,n, null);
  }
  // Call: target, then args
  public Operator call( int nargs ) { return sized(Op.CALL,nargs, nargs+1,1,1, 1,1,1, null); }

  public Operator parameter( int idx ) { return new Operator(Op.PARAMETER,0,0,1, 1,0,0, null,0,idx); }
  public Operator int32Constant( int con ) { return new Operator(Op.INT32_CONSTANT,0,0,0, 1,0,0, null,con,0); }
  public Operator ifValue( int value, int order ) { return new Operator(Op.IF_VALUE,0,0,1, 0,0,1, null,value,order); }

  // Same merge or phi, resized to 'size' merged paths
  public Operator resizeMergeOrPhi( @NotNull Operator op, int size ) {
    return switch( op._op ) {
    case MERGE      -> merge(size);
    case LOOP       -> loop (size);
    case PHI        -> phi(op._rep,size);
    case EFFECT_PHI -> effectPhi(size);
    default -> throw new GraphException("Cannot resize "+op);
    };
  }
}
