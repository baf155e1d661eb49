package com.cliffc.dce.opt;

import com.cliffc.dce.GraphException;
import com.cliffc.dce.node.*;
import com.cliffc.dce.type.Type;
import org.jetbrains.annotations.NotNull;

/** Propagates Dead control and DeadValue values through the graph.
 *
 *  Nodes proven unreachable, or whose value can never exist, are replaced by
 *  one of two sentinels: {@code Dead} for control (and effects) and {@code
 *  DeadValue} for values.  Merges and Loops drop dead paths along with the
 *  matching Phi inputs, dead forks are removed, and effectful nodes fed a
 *  dead value become an explicit {@code Unreachable} trap.
 *
 *  The pass does not discover deadness on its own: it only exploits Dead
 *  markers already in the graph, plus inferred types of NONE.  It holds no
 *  state beyond the two sentinels and is driven node-at-a-time by an Editor.
 */
public class DeadCodeElimination extends AdvancedReducer {
  private final Graph _graph;
  private final Ops _ops;
  private final Node _dead;       // Dead control sentinel
  private final Node _deadValue;  // Dead value sentinel

  public DeadCodeElimination( @NotNull Editor editor, @NotNull Graph graph, @NotNull Ops ops ) {
    super(editor);
    _graph = graph;
    _ops = ops;
    _dead      = graph.newNode(ops.dead     ()).setType(Type.NONE);
    _deadValue = graph.newNode(ops.deadValue()).setType(Type.NONE);
  }

  // Build a driver with just this pass and run it over the whole graph.
  public static DeadCodeElimination run( @NotNull Graph graph ) {
    GraphReducer gr = new GraphReducer(graph);
    DeadCodeElimination dce = new DeadCodeElimination(gr,graph,graph._ops);
    gr.addReducer(dce).setDead(dce.dead());
    gr.reduceGraph();
    return dce;
  }

  @Override public String name() { return "DeadCodeElimination"; }
  public Node dead() { return _dead; }
  public Node deadValue() { return _deadValue; }

  // True if we can guarantee that 'n' will never actually produce a value or
  // effect.
  static boolean noReturn( Node n ) {
    Op op = n.opcode();
    return op == Op.DEAD || op == Op.UNREACHABLE || op == Op.DEAD_VALUE ||
      !n.type().isInhabited();
  }

  static boolean hasDeadInput( Node n ) {
    for( Node def : n.defs() )
      if( noReturn(def) )
        return true;
    return false;
  }

  @Override public Reduction reduce( Node n ) {
    return switch( n.opcode() ) {
    case END -> reduceEnd(n);
    case LOOP, MERGE -> reduceLoopOrMerge(n);
    case LOOP_EXIT -> reduceLoopExit(n);
    case UNREACHABLE, IF_EXCEPTION -> reduceUnreachableOrIfException(n);
    case PHI -> reducePhi(n);
    case EFFECT_PHI, THROW -> propagateDeadControl(n);
    case DEOPTIMIZE, RETURN, TERMINATE -> reduceDeoptimizeOrReturnOrTerminate(n);
    case BRANCH, SWITCH -> reduceBranchOrSwitch(n);
    case START, DEAD, DEAD_VALUE, LOOP_EXIT_VALUE, LOOP_EXIT_EFFECT,
      IF_TRUE, IF_FALSE, IF_VALUE, IF_DEFAULT, IF_SUCCESS,
      PARAMETER, INT32_CONSTANT, INT32_ADD, INT32_LESS_THAN,
      LOAD, STORE, CALL -> reduceNode(n);
    };
  }

  // A node with exactly one control input dies with it.
  private Reduction propagateDeadControl( Node n ) {
    assert n.op()._cin == 1 : n;
    Node ctrl = n.controlInput();
    if( ctrl.opcode() == Op.DEAD ) return replace(ctrl);
    return noChange();
  }

  private Reduction reduceEnd( Node n ) {
    int len = n.len();
    assert len >= 1 : n;
    int live = 0;
    for( int i=0; i<len; i++ ) {
      Node in = n.in(i);
      // Skip dead inputs
      if( in.opcode() == Op.DEAD ) continue;
      // Compact live inputs
      if( i != live ) n.setDef(live,in);
      live++;
    }
    if( live == 0 ) return replace(_dead);
    if( live < len ) {
      n.trimInputCount(live);
      n.setOp(_ops.end(live));
      return changed(n);
    }
    return noChange();
  }

  private Reduction reduceLoopOrMerge( Node n ) {
    assert n.opcode().isMerge() : n;
    int len = n.len();
    assert len >= 1 : n;
    // Count the live inputs and compact them on the fly, compacting the
    // matching inputs of every Phi and EffectPhi at the same time.  A Loop
    // with a dead entry is dead, no matter the back edges.
    int live = 0;
    if( n.opcode() != Op.LOOP || n.in(0).opcode() != Op.DEAD ) {
      for( int i=0; i<len; i++ ) {
        Node in = n.in(i);
        // Skip dead inputs
        if( in.opcode() == Op.DEAD ) continue;
        // Compact live inputs
        if( live != i ) {
          n.setDef(live,in);
          for( Node use : n.uses() )
            if( use.opcode().isPhi() ) {
              if( use.len() != len+1 )
                throw new GraphException(use,"Phi arity does not match "+n);
              use.setDef(live,use.in(i));
            }
        }
        live++;
      }
    }

    if( live == 0 ) return replace(_dead);

    if( live == 1 ) {
      // Due to compaction above, the live input is at offset 0.
      for( Node use : n.uses() ) {
        if( use.isDead() ) continue;
        if( use.opcode().isPhi() ) {
          replace(use,use.in(0));
        } else if( use.opcode() == Op.LOOP_EXIT && use.in(1) == n ) {
          removeLoopExit(use);
        } else if( use.opcode() == Op.TERMINATE ) {
          if( n.opcode() != Op.LOOP )
            throw new GraphException(use,"Terminate on a non-loop "+n);
          replace(use,_dead);
        }
      }
      return replace(n.in(0));
    }

    assert 2 <= live && live <= len;
    // Trim input counts for the Merge or Loop, and all its Phis
    if( live < len ) {
      for( Node use : n.uses() )
        if( use.opcode().isPhi() ) {
          use.setDef(live,n);
          trimMergeOrPhi(use,live);
          revisit(use);
        }
      trimMergeOrPhi(n,live);
      return changed(n);
    }
    return noChange();
  }

  // Splice a LoopExit out: exiting values and effects become the values and
  // effects flowing in, and the exit becomes its outer control.
  private Reduction removeLoopExit( Node n ) {
    assert n.opcode() == Op.LOOP_EXIT : n;
    for( Node use : n.uses() )
      if( use.opcode() == Op.LOOP_EXIT_VALUE || use.opcode() == Op.LOOP_EXIT_EFFECT )
        replace(use,use.in(0));
    Node ctrl = n.controlInput(0);
    replace(n,ctrl);
    return replace(ctrl);
  }

  private Reduction reduceLoopExit( Node n ) {
    Node ctrl = n.controlInput(0);
    Node loop = n.controlInput(1);
    if( ctrl.opcode() == Op.DEAD || loop.opcode() == Op.DEAD )
      return removeLoopExit(n);
    return noChange();
  }

  // Any node not specially handled: at most one control input.
  private Reduction reduceNode( Node n ) {
    Operator op = n.op();
    assert !n.opcode().isGraphTerminator() : n;
    assert op._cin <= 1 : n;
    if( op._cin == 1 ) {
      Reduction r = propagateDeadControl(n);
      if( r.isChanged() ) return r;
    }
    if( op._ein == 0 && (op._cin == 0 || op._cout == 0) )
      return reducePureNode(n);
    if( op._ein > 0 )
      return reduceEffectNode(n);
    return noChange();
  }

  private Reduction reducePhi( Node n ) {
    assert n.opcode() == Op.PHI : n;
    Reduction r = propagateDeadControl(n);
    if( r.isChanged() ) return r;
    if( n.op()._rep == Rep.NONE || !n.type().isInhabited() )
      return replace(_deadValue);
    return noChange();
  }

  private Reduction reducePureNode( Node n ) {
    assert n.op()._ein == 0 : n;
    for( int i=0; i<n.op()._vin; i++ )
      if( noReturn(n.valueInput(i)) )
        return replace(_deadValue);
    return noChange();
  }

  private Reduction reduceUnreachableOrIfException( Node n ) {
    assert n.opcode() == Op.UNREACHABLE || n.opcode() == Op.IF_EXCEPTION : n;
    Reduction r = propagateDeadControl(n);
    if( r.isChanged() ) return r;
    Node effect = n.effectInput();
    if( effect.opcode() == Op.DEAD )
      return replace(effect);
    if( effect.opcode() == Op.UNREACHABLE ) {
      // Second trap on the same path
      relaxEffectsAndControls(n);
      return replace(_deadValue);
    }
    return noChange();
  }

  private Reduction reduceEffectNode( Node n ) {
    if( n.op()._ein != 1 )
      throw new GraphException(n,"Expected exactly one effect input");
    Node effect = n.effectInput();
    if( effect.opcode() == Op.DEAD )
      return replace(effect);
    if( hasDeadInput(n) ) {
      if( effect.opcode() == Op.UNREACHABLE ) {
        relaxEffectsAndControls(n);
        return replace(_deadValue);
      }
      Node ctrl = n.op()._cin == 1 ? n.controlInput() : _graph.start();
      Node unreachable = _graph.newNode(_ops.unreachable(),effect,ctrl).setType(Type.NONE);
      // Effect users stay on 'n' and follow it to the Unreachable
      replaceWithValue(n,_deadValue,n,ctrl);
      return replace(unreachable);
    }
    return noChange();
  }

  private Reduction reduceDeoptimizeOrReturnOrTerminate( Node n ) {
    assert n.opcode() == Op.DEOPTIMIZE || n.opcode() == Op.RETURN || n.opcode() == Op.TERMINATE : n;
    Reduction r = propagateDeadControl(n);
    if( r.isChanged() ) return r;
    if( hasDeadInput(n) ) {
      Node effect = n.effectInput();
      Node ctrl = n.controlInput();
      if( effect.opcode() != Op.UNREACHABLE )
        effect = _graph.newNode(_ops.unreachable(),effect,ctrl).setType(Type.NONE);
      n.trimInputCount(2);
      n.setDef(0,effect);
      n.setDef(1,ctrl);
      n.setOp(_ops.throwOp());
      return changed(n);
    }
    return noChange();
  }

  private Reduction reduceBranchOrSwitch( Node n ) {
    assert n.opcode() == Op.BRANCH || n.opcode() == Op.SWITCH : n;
    Reduction r = propagateDeadControl(n);
    if( r.isChanged() ) return r;
    Node cond = n.valueInput(0);
    if( cond.opcode() == Op.DEAD_VALUE ) {
      // A fork on DeadValue must come from unreachable code and cannot
      // matter, but the effect and control chains are scheduled apart so it
      // can still sit in reachable code.  Remove it by always taking the
      // first projection.
      Node[] projs = NodeProps.collectControlProjections(n);
      replace(projs[0],n.controlInput());
      return replace(_dead);
    }
    return noChange();
  }

  // Shrink a Merge, Loop, Phi or EffectPhi to 'size' merged paths.
  private void trimMergeOrPhi( Node n, int size ) {
    Operator op = _ops.resizeMergeOrPhi(n.op(),size);
    n.trimInputCount(op.inputCount());
    n.setOp(op);
  }
}
