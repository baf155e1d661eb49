package com.cliffc.dce;

import com.cliffc.dce.node.Graph;
import com.cliffc.dce.node.NodePrinter;

/** Dead-code elimination over a Sea-of-Nodes graph.
 *
 *  Process-wide knobs and debug hooks live here.  Tests poke the knobs
 *  directly and call {@link #reset} when done.
 */
public abstract class DCE {
  // Default knob settings
  public static final int     DEF_RSEED     = 0;
  public static final boolean DEF_TRACE     = false;
  public static final boolean DEF_VERIFY    = true;
  public static final int     DEF_MAX_ITERS = 100000;

  public static int RSEED = DEF_RSEED;        // Global random seed for worklist draws
  public static boolean TRACE = DEF_TRACE;    // Print every reduction to stderr
  public static boolean VERIFY = DEF_VERIFY;  // Check graph invariants around a fixpoint
  public static int MAX_ITERS = DEF_MAX_ITERS;// Catch infinite reduce loops

  // Restore all knobs
  public static void reset() {
    RSEED     = DEF_RSEED;
    TRACE     = DEF_TRACE;
    VERIFY    = DEF_VERIFY;
    MAX_ITERS = DEF_MAX_ITERS;
  }

  // Debug printers and finders
  public static String p(Graph g) { return NodePrinter.prettyPrint(g); } // Debugging hook
}
