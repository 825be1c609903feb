package pygen;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.nio.file.Paths;

import org.json.JSONObject;
import org.junit.Test;

import pygen.trans.TargetSupport;

public class PyGenOptionsTest {

	@Test
	public void defaults() {
		PyGenOptions opts = new PyGenOptions();
		assertThat(opts.targetSupport, is(TargetSupport.ENFORCED));
		assertThat(opts.lineWidth, is(80));
		assertThat(opts.indent, is(4));
	}

	@Test
	public void missingSectionKeepsDefaults() {
		PyGenOptions opts = new PyGenOptions(new JSONObject("{\"build\": {}}"));
		assertThat(opts.targetSupport, is(TargetSupport.ENFORCED));
		assertThat(opts.lineWidth, is(PyGenOptions.DEFAULT_LINE_WIDTH));
	}

	@Test
	public void partialSection() {
		PyGenOptions opts = new PyGenOptions(new JSONObject("{\"python\": {\"target_support\": \"optional\"}}"));
		assertThat(opts.targetSupport, is(TargetSupport.OPTIONAL));
		assertFalse(opts.targetSupport.isEnforced());
		assertThat(opts.indent, is(PyGenOptions.DEFAULT_INDENT));
	}

	@Test
	public void fromFile() {
		PyGenOptions opts = PyGenOptions.fromFile(Paths.get("./test/config/optional.json"));
		assertThat(opts.targetSupport, is(TargetSupport.OPTIONAL));
		assertThat(opts.lineWidth, is(100));
		assertThat(opts.indent, is(2));
	}

	@Test(expected = PyGenOptionException.class)
	public void missingFile() {
		PyGenOptions.fromFile(Paths.get("./test/config/does_not_exist.json"));
	}

	@Test
	public void unknownTargetSupport() {
		try {
			new PyGenOptions(new JSONObject("{\"python\": {\"target_support\": \"sometimes\"}}"));
			fail("expected an option error");
		} catch (PyGenOptionException e) {
			assertThat(e.getPrefix(), is("Option Error"));
			assertThat(e.getMsg(), containsString("sometimes"));
		}
	}

	@Test(expected = PyGenOptionException.class)
	public void nonNumericWidth() {
		new PyGenOptions(new JSONObject("{\"python\": {\"line_width\": \"wide\"}}"));
	}

	@Test(expected = PyGenOptionException.class)
	public void nonPositiveWidth() {
		new PyGenOptions(new JSONObject("{\"python\": {\"line_width\": 0}}"));
	}

	@Test
	public void indentMustBePositive() {
		try {
			new PyGenOptions(new JSONObject("{\"python\": {\"indent\": 0}}"));
			fail("expected an option error");
		} catch (PyGenOptionException e) {
			assertThat(e.getMsg(), containsString("indent"));
		}
	}

	@Test(expected = PyGenOptionException.class)
	public void sectionMustBeAnObject() {
		new PyGenOptions(new JSONObject("{\"python\": 3}"));
	}

}
