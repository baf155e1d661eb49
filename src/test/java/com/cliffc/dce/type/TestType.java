package com.cliffc.dce.type;

import org.junit.Test;

import static org.junit.Assert.*;

public class TestType {
  @Test public void testSimple() {
    assertFalse(Type.NONE.isInhabited());
    assertTrue (Type.ALL .isInhabited());
    assertTrue (Type.CTRL.isInhabited());
    assertSame(Type.CTRL,Type.CTRL.union(Type.NONE));
    assertSame(Type.ALL ,Type.CTRL.union(Type.EFFECT));
    assertSame(Type.NONE,Type.CTRL.intersect(Type.EFFECT));
    assertSame(Type.CTRL,Type.CTRL.intersect(Type.ALL));
    assertTrue(Type.NONE.is(Type.CTRL));
    assertTrue(Type.CTRL.is(Type.ALL));
    assertFalse(Type.ALL.is(Type.CTRL));
  }

  @Test public void testInts() {
    TypeInt i3 = TypeInt.con(3);
    assertSame(i3,TypeInt.con(3));
    assertTrue(i3.is_con());
    assertEquals("3",i3.toString());
    assertEquals("Int32",TypeInt.INT32.toString());
    assertSame(TypeInt.make(0,3),TypeInt.BOOL.union(i3));
    assertEquals("[0..3]",TypeInt.BOOL.union(i3).toString());
    assertSame(TypeInt.con(1),TypeInt.BOOL.intersect(TypeInt.make(1,5)));
    // Disjoint and empty ranges are uninhabited
    assertSame(Type.NONE,TypeInt.BOOL.intersect(i3));
    assertSame(Type.NONE,TypeInt.make(5,3));
    assertSame(Type.ALL ,TypeInt.BOOL.union(Type.CTRL));
    assertTrue(TypeInt.BOOL.is(TypeInt.INT32));
    assertFalse(TypeInt.INT32.is(TypeInt.BOOL));
  }
}
