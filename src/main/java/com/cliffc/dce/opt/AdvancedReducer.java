package com.cliffc.dce.opt;

import com.cliffc.dce.node.Node;

// A Reducer that also edits nodes around the one being reduced, through an
// Editor.
public abstract class AdvancedReducer implements Reducer {
  private final Editor _editor;
  protected AdvancedReducer( Editor editor ) { _editor = editor; }

  protected static Reduction noChange() { return Reduction.noChange(); }
  protected static Reduction changed( Node n ) { return Reduction.changed(n); }
  // Replace the node being reduced
  protected static Reduction replace( Node n ) { return Reduction.replace(n); }

  // Replace some other node
  protected void replace( Node node, Node replacement ) { _editor.replace(node,replacement); }
  protected void revisit( Node node ) { _editor.revisit(node); }
  protected void replaceWithValue( Node node, Node value, Node effect, Node control ) {
    _editor.replaceWithValue(node,value,effect,control);
  }
  // Unhook 'node' from its effect and control users, wiring them to the
  // node's own effect and control inputs.  Value users stay.
  protected void relaxEffectsAndControls( Node node ) {
    _editor.replaceWithValue(node,node,null,null);
  }
}
