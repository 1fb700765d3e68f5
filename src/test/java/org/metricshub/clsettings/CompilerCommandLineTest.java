package org.metricshub.clsettings;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;
import org.metricshub.clsettings.args.OptionClassifier;
import org.metricshub.clsettings.model.CompilerSettings;
import org.metricshub.clsettings.model.WarningState;

/**
 * Unit tests for {@link CompilerCommandLine}.
 */
public class CompilerCommandLineTest {

	@Test
	public void testEmptyAndNull() {
		assertEquals(CompilerSettings.DEFAULT, CompilerCommandLine.parse(null));
		assertEquals(CompilerSettings.DEFAULT, CompilerCommandLine.parse(""));
		CompilerSettings settings = CompilerCommandLine.parse(null);
		assertEquals("", settings.getRaw());
		assertEquals(0, settings.getWarningLevel());
		assertFalse(settings.isWarningsAsErrors());
		assertFalse(settings.isOptimizationsEnabled());
		assertFalse(settings.isUsesDebugCRuntime());
		assertFalse(settings.isEliminateDuplicateStringsEnabled());
		assertFalse(settings.isWholeProgramOptimizationEnabled());
		assertTrue(settings.getWarningsExplicitlyDisabled().isEmpty());
	}

	@Test
	public void testRawIsKept() {
		String raw = "  cl.exe  /c \"a b.cpp\"  ";
		assertEquals(raw, CompilerCommandLine.parse(raw).getRaw());
	}

	@Test
	public void testWarningLevelAndDisabledWarnings() {
		CompilerSettings settings = CompilerCommandLine.parse("cl.exe /c /W3 /wd4996 /wd4100");
		assertEquals(3, settings.getWarningLevel());
		assertEquals(Arrays.asList(4100, 4996), settings.getWarningsExplicitlyDisabled());
		assertTrue(settings.isWarningExplicitlyDisabled(4996));
		assertFalse(settings.isWarningExplicitlyDisabled(4101));
	}

	@Test
	public void testLastDirectiveWins() {
		// the level 1 directive comes last and /W1 reports level 1 warnings
		assertEquals(
				Collections.emptyList(),
				CompilerCommandLine.parse("cl.exe /c /W1 /wd4265 /w14265 C4265.cpp").getWarningsExplicitlyDisabled());
		assertEquals(
				Arrays.asList(4265),
				CompilerCommandLine.parse("cl.exe /c /W1 /w14265 /wd4265 C4265.cpp").getWarningsExplicitlyDisabled());
	}

	@Test
	public void testOnceCountsAsEnabled() {
		assertEquals(
				Collections.emptyList(),
				CompilerCommandLine.parse("cl.exe /c /W1 /wd4265 /w14265 /wo4265 C4265.cpp").getWarningsExplicitlyDisabled());
	}

	@Test
	public void testAsErrorCountsAsEnabled() {
		assertEquals(Collections.emptyList(), CompilerCommandLine.parse("cl.exe /w /we4996").getWarningsExplicitlyDisabled());
		assertEquals(Arrays.asList(4996), CompilerCommandLine.parse("cl.exe /w /w14996").getWarningsExplicitlyDisabled());
	}

	@Test
	public void testPerWarningLevelUsesFinalWarningLevel() {
		assertFalse(CompilerCommandLine.parse("cl.exe /w14996 /W2").isWarningExplicitlyDisabled(4996));
		assertFalse(CompilerCommandLine.parse("cl.exe /W2 /w14996").isWarningExplicitlyDisabled(4996));
		assertTrue(CompilerCommandLine.parse("cl.exe /w34996 /W2").isWarningExplicitlyDisabled(4996));
		assertTrue(CompilerCommandLine.parse("cl.exe /W2 /w34996").isWarningExplicitlyDisabled(4996));
		assertFalse(CompilerCommandLine.parse("cl.exe /w44996 /Wall").isWarningExplicitlyDisabled(4996));
	}

	@Test
	public void testOptimizationsAndRuntime() {
		CompilerSettings settings = CompilerCommandLine.parse("cl.exe /O2 /MDd /GL");
		assertTrue(settings.isOptimizationsEnabled());
		assertTrue(settings.isEliminateDuplicateStringsEnabled());
		assertTrue(settings.isUsesDebugCRuntime());
		assertTrue(settings.isWholeProgramOptimizationEnabled());
	}

	@Test
	public void testOptimizationVariants() {
		for (String option : new String[] { "/O1", "/O2", "-O1", "-O2" }) {
			CompilerSettings settings = CompilerCommandLine.parse("cl.exe " + option);
			assertTrue(option, settings.isOptimizationsEnabled());
			assertTrue(option, settings.isEliminateDuplicateStringsEnabled());
		}
		for (String option : new String[] { "/Og", "/Os", "/Ot", "/Ox" }) {
			CompilerSettings settings = CompilerCommandLine.parse("cl.exe " + option);
			assertTrue(option, settings.isOptimizationsEnabled());
			assertFalse(option, settings.isEliminateDuplicateStringsEnabled());
		}
		CompilerSettings disabled = CompilerCommandLine.parse("cl.exe /O2 /Od");
		assertFalse(disabled.isOptimizationsEnabled());
		// /Od leaves string pooling alone
		assertTrue(disabled.isEliminateDuplicateStringsEnabled());
		assertTrue(CompilerCommandLine.parse("cl.exe /Od /Ox").isOptimizationsEnabled());
	}

	@Test
	public void testDuplicateStringElimination() {
		assertTrue(CompilerCommandLine.parse("cl.exe /GF").isEliminateDuplicateStringsEnabled());
		assertFalse(CompilerCommandLine.parse("cl.exe /GF-").isEliminateDuplicateStringsEnabled());
	}

	@Test
	public void testCRuntime() {
		assertTrue(CompilerCommandLine.parse("cl.exe /MTd").isUsesDebugCRuntime());
		assertFalse(CompilerCommandLine.parse("cl.exe /MTd /MT").isUsesDebugCRuntime());
		assertFalse(CompilerCommandLine.parse("cl.exe /MDd /MD").isUsesDebugCRuntime());
		assertTrue(CompilerCommandLine.parse("cl.exe /MD /MDd").isUsesDebugCRuntime());
	}

	@Test
	public void testWholeProgramOptimization() {
		assertFalse(CompilerCommandLine.parse("cl.exe /GL /GL-").isWholeProgramOptimizationEnabled());
		assertTrue(CompilerCommandLine.parse("cl.exe /GL- /GL").isWholeProgramOptimizationEnabled());
	}

	@Test
	public void testWarningsAsErrors() {
		CompilerSettings settings = CompilerCommandLine.parse("cl.exe /Wall /WX-");
		assertEquals(4, settings.getWarningLevel());
		assertFalse(settings.isWarningsAsErrors());
		assertTrue(CompilerCommandLine.parse("cl.exe /WX- /WX").isWarningsAsErrors());
		assertFalse(CompilerCommandLine.parse("cl.exe /WX /WX-").isWarningsAsErrors());
	}

	@Test
	public void testGlobalWarningLevel() {
		assertEquals(0, CompilerCommandLine.parse("cl.exe /W4 /w").getWarningLevel());
		assertEquals(2, CompilerCommandLine.parse("cl.exe /w /W2").getWarningLevel());
		assertEquals(0, CompilerCommandLine.parse("cl.exe /Wall /W0").getWarningLevel());
		assertEquals(3, CompilerCommandLine.parse("cl.exe /W3 /W5 /W9").getWarningLevel());
		assertEquals(4, CompilerCommandLine.parse("cl.exe -W1 -Wall").getWarningLevel());
	}

	@Test
	public void testMatchingDependsOnLength() {
		CompilerSettings settings = CompilerCommandLine.parse("cl.exe /XO2 /ZMDd /Wallx /FoGL /wd49960");
		assertFalse(settings.isOptimizationsEnabled());
		assertFalse(settings.isUsesDebugCRuntime());
		assertEquals(0, settings.getWarningLevel());
		assertFalse(settings.isWholeProgramOptimizationEnabled());
		assertTrue(settings.getWarningsExplicitlyDisabled().isEmpty());
	}

	@Test
	public void testMalformedWarningDirectivesAreIgnored() {
		CompilerSettings settings = CompilerCommandLine.parse("cl.exe /W4 /wd49x6 /wd+996 /wx4996 /w54996 /w04996 /Wd4996 /wd 4996");
		assertEquals(4, settings.getWarningLevel());
		assertTrue(settings.getWarningsExplicitlyDisabled().isEmpty());
	}

	@Test
	public void testPositionalArgumentsAreIgnored() {
		CompilerSettings settings = CompilerCommandLine.parse("cl.exe wd4996 W4 O2 a.cpp");
		assertEquals(CompilerSettings.DEFAULT.getWarningLevel(), settings.getWarningLevel());
		assertFalse(settings.isOptimizationsEnabled());
		assertTrue(settings.getWarningsExplicitlyDisabled().isEmpty());
	}

	@Test
	public void testQuotedArguments() {
		CompilerSettings settings = CompilerCommandLine
				.parse("\"C:\\Program Files\\MSVC\\cl.exe\" /c \"/wd4996\" \"/D X=/W4\" \"b c.cpp\"");
		assertEquals(0, settings.getWarningLevel());
		assertEquals(Arrays.asList(4996), settings.getWarningsExplicitlyDisabled());
	}

	@Test
	public void testDuplicatedDirectives() {
		assertEquals(
				Arrays.asList(4100, 4996),
				CompilerCommandLine.parse("cl.exe /wd4996 /wd4100 /wd4996 /W3").getWarningsExplicitlyDisabled());
	}

	@Test
	public void testInjectedCollaborators() {
		CompilerCommandLine resolver = new CompilerCommandLine(
				(raw) -> Arrays.asList(raw.split(",")),
				(argument) -> argument.startsWith("-"));
		CompilerSettings settings = resolver.resolve("cl.exe,-W2,/W4,-wd4996,/wd4100");
		assertEquals(2, settings.getWarningLevel());
		assertEquals(Arrays.asList(4996), settings.getWarningsExplicitlyDisabled());
	}

	@Test(expected = NullPointerException.class)
	public void testNullTokenizer() {
		new CompilerCommandLine(null, OptionClassifier.SWITCH);
	}

	@Test
	public void testIdempotence() {
		String raw = "cl.exe /c /W3 /O2 /MTd /GL /wd4996 /w44100 /we4018";
		CompilerSettings first = CompilerCommandLine.parse(raw);
		CompilerSettings second = CompilerCommandLine.parse(raw);
		assertNotSame(first, second);
		assertEquals(first, second);
		assertEquals(first.hashCode(), second.hashCode());
		assertEquals(first.toDescriptionString(), second.toDescriptionString());
	}

	@Test
	public void testIsEnabled() {
		assertTrue(CompilerCommandLine.isEnabled(WarningState.AS_ERROR, 0));
		assertTrue(CompilerCommandLine.isEnabled(WarningState.ONCE, 0));
		assertFalse(CompilerCommandLine.isEnabled(WarningState.DISABLED, 4));
		assertTrue(CompilerCommandLine.isEnabled(WarningState.LEVEL3, 3));
		assertFalse(CompilerCommandLine.isEnabled(WarningState.LEVEL4, 3));
		assertTrue(CompilerCommandLine.isEnabled(null, 0));
	}
}
