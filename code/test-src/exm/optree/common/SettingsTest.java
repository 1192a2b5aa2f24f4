package exm.optree.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Test;

import exm.optree.common.exceptions.InvalidOptionException;
import exm.optree.common.exceptions.OpTreeRuntimeError;

public class SettingsTest {

  @After
  public void tearDown() {
    Settings.reset(Settings.VERIFY_DEEP);
    Settings.reset(Settings.VALIDATE_MAX_VIOLATIONS);
    System.clearProperty(Settings.VALIDATE_MAX_VIOLATIONS);
  }

  @Test
  public void testDefaults() throws InvalidOptionException {
    assertFalse(Settings.getBoolean(Settings.VERIFY_DEEP));
    assertFalse(Settings.getBoolean(Settings.LOG_TRACE));
    assertEquals(100, Settings.getLong(Settings.VALIDATE_MAX_VIOLATIONS));
    assertTrue(Settings.getKeys().contains(Settings.LOG_FILE));
  }

  @Test
  public void testSetAndReset() throws InvalidOptionException {
    Settings.set(Settings.VERIFY_DEEP, " TRUE ");
    assertTrue(Settings.getBoolean(Settings.VERIFY_DEEP));
    Settings.reset(Settings.VERIFY_DEEP);
    assertFalse(Settings.getBoolean(Settings.VERIFY_DEEP));
  }

  @Test(expected=InvalidOptionException.class)
  public void testBadBoolean() throws InvalidOptionException {
    Settings.set(Settings.VERIFY_DEEP, "yes");
    Settings.getBoolean(Settings.VERIFY_DEEP);
  }

  @Test(expected=OpTreeRuntimeError.class)
  public void testBadLongUnchecked() {
    Settings.set(Settings.VALIDATE_MAX_VIOLATIONS, "lots");
    Settings.getLongUnchecked(Settings.VALIDATE_MAX_VIOLATIONS);
  }

  @Test
  public void testSystemPropertyOverride() throws InvalidOptionException {
    System.setProperty(Settings.VALIDATE_MAX_VIOLATIONS, "7");
    Settings.initOpTreeProperties();
    assertEquals(7, Settings.getLong(Settings.VALIDATE_MAX_VIOLATIONS));
  }

  @Test(expected=InvalidOptionException.class)
  public void testMaxViolationsPositive() throws InvalidOptionException {
    System.setProperty(Settings.VALIDATE_MAX_VIOLATIONS, "0");
    Settings.initOpTreeProperties();
  }
}
