package com.cliffc.dce.util;

import java.util.function.IntSupplier;

// Simple worklist.  Filters dups on a add.
// Constant-time remove until empty.
// Supports psuedo random pop.
@SuppressWarnings("unchecked")
public class Work<E extends IntSupplier> {
  private final Ary<Object> _work = new Ary<>(new Object[1],0);
  private final VBitSet _on = new VBitSet();
  public final String _name;
  private int _rseed;           // Psuedo-random draw
  private int _idx;             // Next item to get
  public Work(String name, int rseed) { _name = name; _rseed = rseed; }
  public int len() { return _work._len; }
  public boolean isEmpty() { return _work.isEmpty(); }
  public E add(E e) {           // Add, filtering dups
    if( e!=null && !_on.tset(e.getAsInt()) )
      _work.push(e);
    return e;
  }
  // Bulk adders
  public void addAll(Ary<? extends E> es) { if( es!=null ) for( E e : es ) add(e); }
  // Pull a psuedo-random element.  Order depends on rseed.
  public E pop() {
    if( _work._len==0 ) return null;
    _idx = (_idx+_rseed)&((1<<30)-1);
    E e = (E)_work.del( _idx % _work._len );
    _on.clear(e.getAsInt());
    return e;
  }
  @Override public String toString() { return _name+_on.toString(); }
}
