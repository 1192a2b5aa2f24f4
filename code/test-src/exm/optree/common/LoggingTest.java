package exm.optree.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Enumeration;

import org.apache.log4j.Appender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import exm.optree.common.exceptions.InvalidOptionException;

public class LoggingTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  private Level savedLevel;

  @Before
  public void saveLevel() {
    savedLevel = Logging.getOpTreeLogger().getLevel();
  }

  @After
  public void restoreLogger() {
    Logger logger = Logging.getOpTreeLogger();
    Enumeration<?> appenders = logger.getAllAppenders();
    while (appenders.hasMoreElements()) {
      ((Appender)appenders.nextElement()).close();
    }
    logger.removeAllAppenders();
    logger.setLevel(savedLevel);
    System.clearProperty(Settings.LOG_FILE);
    System.clearProperty(Settings.LOG_TRACE);
    Settings.reset(Settings.LOG_FILE);
    Settings.reset(Settings.LOG_TRACE);
  }

  @Test
  public void testAddEmittedOnce() {
    assertTrue(Logging.addEmitted(Level.WARN, "LoggingTest message"));
    assertFalse(Logging.addEmitted(Level.WARN, "LoggingTest message"));
    assertTrue(Logging.addEmitted(Level.INFO, "LoggingTest message"));
  }

  @Test
  public void testSetupLoggingToFile() throws IOException {
    File log = tmp.newFile("optree.log");
    Logger logger = Logging.setupLogging(log.getPath(), false);
    assertEquals(Level.DEBUG, logger.getLevel());
    logger.debug("to the file");
    Logging.uniqueWarn("unique warning");
    Logging.uniqueWarn("unique warning");

    String text = new String(Files.readAllBytes(log.toPath()),
                             StandardCharsets.UTF_8);
    assertTrue(text, text.contains("to the file"));
    int warnings = 0;
    for (String line: text.split("\n")) {
      if (line.startsWith("WARN") && line.contains("unique warning")) {
        warnings++;
      }
    }
    assertEquals(1, warnings);
    assertTrue(text.contains("Duplicate Warning: unique warning"));
  }

  @Test
  public void testSetupFromSettings()
      throws IOException, InvalidOptionException {
    File log = tmp.newFile("trace.log");
    System.setProperty(Settings.LOG_FILE, log.getPath());
    System.setProperty(Settings.LOG_TRACE, "true");
    Logger logger = Logging.setupFromSettings();
    assertEquals(Level.TRACE, logger.getLevel());
    logger.trace("traced");
    String text = new String(Files.readAllBytes(log.toPath()),
                             StandardCharsets.UTF_8);
    assertTrue(text, text.contains("traced"));
  }

  @Test
  public void testNoLogFile() {
    Logger logger = Logging.setupLogging("", false);
    assertFalse(logger.getAllAppenders().hasMoreElements());
  }
}
