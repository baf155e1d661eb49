package com.cliffc.dce.util;

import java.lang.reflect.Array;
import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

// ArrayList with saner syntax
@SuppressWarnings("unchecked")
public class Ary<E> implements Iterable<E> {
  public E[] _es;
  public int _len;
  public Ary(E[] es) { this(es,es.length); }
  public Ary(E[] es, int len) { _es=es; _len=len; }
  public Ary(Class<E> clazz) { this((E[]) Array.newInstance(clazz, 1),0); }

  /** @return list is empty */
  public boolean isEmpty() { return _len==0; }
  /** @return active list length */
  public int len() { return _len; }
  /** @param i element index
   *  @return element being returned; throws if OOB */
  public E at( int i ) {
    range_check(i);
    return _es[i];
  }
  /** @param i element index
   *  @return element being returned, or null if OOB */
  public E atX( int i ) {
    return i < _len ? _es[i] : null;
  }
  /** @return last element */
  public E last( ) {
    range_check(0);
    return _es[_len-1];
  }

  /** @return remove and return last element */
  public E pop( ) {
    range_check(0);
    return _es[--_len];
  }

  /** Add element in amortized constant time
   *  @param e Element to add at end of list
   *  @return 'e' for flow-coding */
  public E push( E e ) {
    if( _len >= _es.length ) _es = Arrays.copyOf(_es,Math.max(1,_es.length<<1));
    return (_es[_len++] = e);
  }

  /** Fast, constant-time, element removal.  Does not preserve order
   *  @param i element to be removed
   *  @return element removed */
  public E del( int i ) {
    range_check(i);
    E tmp = _es[i];
    _es[i]=_es[--_len];
    return tmp;
  }

  /** Remove all elements */
  public Ary<E> clear( ) { Arrays.fill(_es,0,_len,null); _len=0; return this; }

  public E set( int i, E e ) {
    range_check(i);
    return (_es[i] = e);
  }

  /** @return index of first pointer-equal element, or -1 if none */
  public int find( E e ) {
    for( int i=0; i<_len; i++ )  if( _es[i]==e )  return i;
    return -1;
  }

  /** @return an iterator */
  @Override public Iterator<E> iterator() { return new Iter(); }
  private class Iter implements Iterator<E> {
    int _i=0;
    @Override public boolean hasNext() { return _i<_len; }
    @Override public E next() {
      if( _i>=_len ) throw new NoSuchElementException();
      return _es[_i++];
    }
  }

  @Override public String toString() {
    SB sb = new SB().p('{');
    for( int i=0; i<_len; i++ ) {
      if( i>0 ) sb.p(',');
      if( _es[i] != null ) sb.p(_es[i].toString());
    }
    return sb.p('}').toString();
  }

  private void range_check( int i ) {
    if( i < 0 || i>=_len )
      throw new ArrayIndexOutOfBoundsException(""+i+" >= "+_len);
  }
}
