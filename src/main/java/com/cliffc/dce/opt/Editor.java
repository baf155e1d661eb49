package com.cliffc.dce.opt;

import com.cliffc.dce.node.Node;

// Graph edits a reducer may make on nodes other than the one it is reducing.
// Implemented by the driver, which also schedules the revisits.
public interface Editor {
  // Point every use of 'node' at 'replacement', revisit the users, and kill 'node'.
  void replace( Node node, Node replacement );

  // Put 'node' back on the worklist.
  void revisit( Node node );

  // Split the uses of 'node' by edge kind: value uses go to 'value', effect
  // uses to 'effect', control uses to 'control'.  A null effect or control
  // defaults to the node's own effect or control input.
  void replaceWithValue( Node node, Node value, Node effect, Node control );
}
