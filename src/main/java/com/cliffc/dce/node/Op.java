package com.cliffc.dce.node;

// The closed set of node kinds.  Every switch over Op in the reducers is
// exhaustive, so a new kind must be placed by hand at each dispatch site.
public enum Op {
  START("Start"),               // Graph root; control, effect and parameters
  END("End"),                   // Graph sink; one control per program exit
  DEAD("Dead"),                 // Dead control sentinel
  DEAD_VALUE("DeadValue"),      // Dead value sentinel
  UNREACHABLE("Unreachable"),   // Explicit trap on the effect chain
  MERGE("Merge"),               // Control join
  LOOP("Loop"),                 // Control join; input 0 is the loop entry
  LOOP_EXIT("LoopExit"),        // Leave a loop: {control, loop}
  LOOP_EXIT_VALUE("LoopExitValue"),   // Value escaping a loop: {value, loop-exit}
  LOOP_EXIT_EFFECT("LoopExitEffect"), // Effect escaping a loop: {effect, loop-exit}
  PHI("Phi"),                   // Value merge: {values..., merge}
  EFFECT_PHI("EffectPhi"),      // Effect merge: {effects..., merge}
  BRANCH("Branch"),             // Two-way fork: {cond, control}
  SWITCH("Switch"),             // N-way fork: {key, control}
  IF_TRUE("IfTrue"),
  IF_FALSE("IfFalse"),
  IF_VALUE("IfValue"),
  IF_DEFAULT("IfDefault"),
  IF_SUCCESS("IfSuccess"),      // Normal exit of a throwing call
  IF_EXCEPTION("IfException"),  // Exceptional exit of a throwing call
  DEOPTIMIZE("Deoptimize"),
  RETURN("Return"),
  TERMINATE("Terminate"),       // Loop re-entry guard, keeps endless loops reachable from End
  THROW("Throw"),
  PARAMETER("Parameter"),
  INT32_CONSTANT("Int32Constant"),
  INT32_ADD("Int32Add"),
  INT32_LESS_THAN("Int32LessThan"),
  LOAD("Load"),
  STORE("Store"),
  CALL("Call");

  public final String _name;
  Op( String name ) { _name = name; }

  public boolean isMerge() { return this==MERGE || this==LOOP; }
  public boolean isPhi  () { return this==PHI || this==EFFECT_PHI; }
  // Nodes which end a control path and feed End
  public boolean isGraphTerminator() {
    return this==DEOPTIMIZE || this==RETURN || this==TERMINATE || this==THROW;
  }
  @Override public String toString() { return _name; }
}
