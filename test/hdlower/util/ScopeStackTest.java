package hdlower.util;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ScopeStackTest {

  @Test
  void testPushPop() {
    ScopeStack<String> stack = new ScopeStack<>();
    Assertions.assertTrue(stack.isEmpty());
    stack.push("outer");
    stack.push("inner");
    Assertions.assertEquals(2, stack.depth());
    Assertions.assertEquals("inner", stack.top());

    List<String> order = new ArrayList<>();
    stack.forEach(order::add);
    Assertions.assertEquals(List.of("inner", "outer"), order);

    Assertions.assertEquals("inner", stack.pop());
    Assertions.assertEquals("outer", stack.pop());
    Assertions.assertTrue(stack.isEmpty());
  }

  @Test
  void testUnderflow() {
    ScopeStack<Integer> stack = new ScopeStack<>();
    Assertions.assertThrows(NoSuchElementException.class, stack::pop);
    Assertions.assertThrows(NoSuchElementException.class, stack::top);
  }
}
