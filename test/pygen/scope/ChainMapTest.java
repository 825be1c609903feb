package pygen.scope;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;

import org.junit.Test;

public class ChainMapTest {

	@Test
	public void lookupsFallBackToParent() {
		Map<String, Integer> parent = new HashMap<>();
		parent.put("a", 1);
		ChainMap<String, Integer> child = new ChainMap<>(parent);
		assertThat(child.get("a"), is(1));
		assertTrue(child.containsKey("a"));
		assertTrue(child.containsValue(1));
		assertFalse(child.isEmpty());
		assertThat(child.getParent(), sameInstance(parent));
	}

	@Test
	public void writesStayInChild() {
		Map<String, Integer> parent = new HashMap<>();
		parent.put("a", 1);
		ChainMap<String, Integer> child = new ChainMap<>(parent);
		assertThat(child.put("a", 2), is(1));
		child.put("b", 3);
		assertThat(child.get("a"), is(2));
		assertThat(parent.get("a"), is(1));
		assertFalse(parent.containsKey("b"));
		assertEquals(new HashSet<>(Arrays.asList("a", "b")), child.keySet());
		assertThat(child.size(), is(2));
	}

}
