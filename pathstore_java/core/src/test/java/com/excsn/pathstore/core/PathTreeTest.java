package com.excsn.pathstore.core;

import com.excsn.pathstore.core.telemetry.Logger;
import com.excsn.pathstore.core.telemetry.StatsRecorder;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

public class PathTreeTest {

  private Logger _logger;
  private StatsRecorder _statsRecorder;
  private PathTree _tree;

  @BeforeEach
  public void setup() {

    _logger = Mockito.mock(Logger.class);
    _statsRecorder = Mockito.mock(StatsRecorder.class);
    _tree = new PathTree(_logger, _statsRecorder);
  }

  @Test
  public void freshTreeHoldsOnlyAnchors() {

    Assertions.assertEquals(List.of("/system", "/system/config"), _tree.paths());
    Assertions.assertEquals(List.of("/system/config"), _tree.ls("/system"));
    Assertions.assertEquals(1, _tree.countChildren("/system"));
    Assertions.assertNull(_tree.get("/system"));
  }

  @Test
  public void setThenGetReturnsValue() {

    _tree.set("/files/etc/hosts/1/ipaddr", "127.0.0.1");

    Assertions.assertEquals("127.0.0.1", _tree.get("/files/etc/hosts/1/ipaddr"));
    Assertions.assertTrue(_tree.exists("/files/etc/hosts/1/ipaddr"));
  }

  @Test
  public void setReplacesExistingValue() {

    _tree.set("/a", "1");
    _tree.set("/a", "2");

    Assertions.assertEquals("2", _tree.get("/a"));
    Assertions.assertEquals(3, _tree.size());
  }

  @Test
  public void repeatedSetLeavesSameState() {

    _tree.set("/a/b", "x");
    var before = _tree.paths();

    _tree.set("/a/b", "x");

    Assertions.assertEquals(before, _tree.paths());
    Assertions.assertEquals("x", _tree.get("/a/b"));
  }

  @Test
  public void setMaterializesAncestors() {

    _tree.set("/a/b/c", "x");

    Assertions.assertTrue(_tree.exists("/a"));
    Assertions.assertTrue(_tree.exists("/a/b"));
    Assertions.assertNull(_tree.get("/a"));
    Assertions.assertNull(_tree.get("/a/b"));
    Assertions.assertEquals(List.of("/system", "/system/config", "/a", "/a/b", "/a/b/c"), _tree.paths());
  }

  @Test
  public void ancestorsAreAppendedAtTheEndOfTheList() {

    _tree.set("/a/x", "1");
    _tree.set("/b/y", "2");
    _tree.set("/a/z/w", "3");

    Assertions.assertEquals(
      List.of("/system", "/system/config", "/a", "/a/x", "/b", "/b/y", "/a/z", "/a/z/w"),
      _tree.paths()
    );
  }

  @Test
  public void trailingSeparatorNamesSameEntry() {

    _tree.set("/a/b/", "x");

    Assertions.assertTrue(_tree.exists("/a/b"));
    Assertions.assertEquals("x", _tree.get("/a/b/"));
    Assertions.assertFalse(_tree.paths().contains("/a/b/"));
  }

  @Test
  public void setNullCreatesEntryWithoutValue() {

    _tree.set("/a", "1");
    _tree.set("/a", null);
    _tree.set("/b", null);

    Assertions.assertTrue(_tree.exists("/a"));
    Assertions.assertNull(_tree.get("/a"));
    Assertions.assertTrue(_tree.exists("/b"));
  }

  @Test
  public void setRejectsRelativeAndEmptyPaths() {

    Assertions.assertThrows(IllegalArgumentException.class, () -> _tree.set("a/b", "x"));
    Assertions.assertThrows(IllegalArgumentException.class, () -> _tree.set("", "x"));
    Assertions.assertThrows(IllegalArgumentException.class, () -> _tree.set("/", "x"));
    Assertions.assertThrows(NullPointerException.class, () -> _tree.set(null, "x"));
  }

  @Test
  public void findIsExactNotPrefix() {

    _tree.set("/abc", "x");

    Assertions.assertFalse(_tree.exists("/ab"));
    Assertions.assertFalse(_tree.exists("/abcd"));
    Assertions.assertNull(_tree.get("/ab"));
  }

  @Test
  public void insertPlacesNewEntryBeforeSibling() {

    _tree.set("/a/y", "1");

    Assertions.assertTrue(_tree.insert("/a/x", "/a/y"));

    Assertions.assertEquals(List.of("/a/x", "/a/y"), _tree.ls("/a"));
    Assertions.assertNull(_tree.get("/a/x"));
  }

  @Test
  public void insertMovesExistingEntryAndKeepsValue() {

    _tree.set("/a/1", "one");
    _tree.set("/a/2", "two");
    _tree.set("/a/3", "three");

    Assertions.assertTrue(_tree.insert("/a/3", "/a/1"));

    Assertions.assertEquals(List.of("/a/3", "/a/1", "/a/2"), _tree.ls("/a"));
    Assertions.assertEquals("three", _tree.get("/a/3"));
    Assertions.assertEquals(5, _tree.size());
  }

  @Test
  public void insertBeforeImmediateSuccessorIsNoop() {

    _tree.set("/a/1", "one");
    _tree.set("/a/2", "two");
    var before = _tree.paths();

    Assertions.assertTrue(_tree.insert("/a/1", "/a/2"));

    Assertions.assertEquals(before, _tree.paths());
  }

  @Test
  public void insertAcrossParentsFailsWithoutChange() {

    _tree.set("/a/y", "1");
    _tree.set("/b/y", "2");
    var before = _tree.paths();

    Assertions.assertFalse(_tree.insert("/a/x", "/b/y"));
    Assertions.assertFalse(_tree.insert("/ab/x", "/a/y"));

    Assertions.assertEquals(before, _tree.paths());
    Assertions.assertFalse(_tree.exists("/a/x"));
  }

  @Test
  public void insertOfItselfFails() {

    _tree.set("/a/y", "1");
    var before = _tree.paths();

    Assertions.assertFalse(_tree.insert("/a/y", "/a/y"));
    Assertions.assertFalse(_tree.insert("/a/y/", "/a/y"));

    Assertions.assertEquals(before, _tree.paths());
  }

  @Test
  public void insertBeforeMissingSiblingFails() {

    _tree.set("/a/y", "1");
    var before = _tree.paths();

    Assertions.assertFalse(_tree.insert("/a/x", "/a/z"));

    Assertions.assertEquals(before, _tree.paths());
  }

  @Test
  public void insertReordersTopLevelEntries() {

    _tree.set("/a", null);
    _tree.set("/b", null);

    Assertions.assertTrue(_tree.insert("/b", "/a"));

    Assertions.assertEquals(List.of("/system", "/b", "/a"), _tree.ls("/"));
    Assertions.assertEquals(0, _tree.print(new PrintStream(new ByteArrayOutputStream()), null));
  }

  @Test
  public void insertBeforeHeadAppendsToList() {

    _tree.set("/files", null);
    _tree.set("/a", null);

    Assertions.assertTrue(_tree.insert("/files", "/system"));

    Assertions.assertEquals(List.of("/system", "/system/config", "/a", "/files"), _tree.paths());
  }

  @Test
  public void rmRemovesSubtree() {

    _tree.set("/a/b/c", "x");

    Assertions.assertEquals(3, _tree.rm("/a"));

    Assertions.assertFalse(_tree.exists("/a"));
    Assertions.assertFalse(_tree.exists("/a/b"));
    Assertions.assertFalse(_tree.exists("/a/b/c"));
    Assertions.assertEquals(0, _tree.rm("/a"));
  }

  @Test
  public void rmRespectsSegmentBoundary() {

    _tree.set("/a/b", "1");
    _tree.set("/ab/c", "2");

    Assertions.assertEquals(2, _tree.rm("/a"));

    Assertions.assertTrue(_tree.exists("/ab"));
    Assertions.assertTrue(_tree.exists("/ab/c"));
  }

  @Test
  public void rmHandlesAdjacentMatchesAfterReorder() {

    _tree.set("/a/1", "1");
    _tree.set("/b/1", "2");
    _tree.set("/a/2", "3");
    _tree.insert("/a/2", "/a/1");

    Assertions.assertEquals(3, _tree.rm("/a"));
    Assertions.assertEquals(List.of("/system", "/system/config", "/b", "/b/1"), _tree.paths());
    Assertions.assertEquals(0, _tree.print(new PrintStream(new ByteArrayOutputStream()), null));
  }

  @Test
  public void rmNeverRemovesAnchors() {

    Assertions.assertEquals(0, _tree.rm("/system"));
    Assertions.assertEquals(0, _tree.rm("/system/config"));

    _tree.set("/system/config/save/mode", "backup");
    _tree.set("/files/x", "1");

    Assertions.assertEquals(2, _tree.rm("/system"));
    Assertions.assertTrue(_tree.exists("/system"));
    Assertions.assertTrue(_tree.exists("/system/config"));
    Assertions.assertFalse(_tree.exists("/system/config/save"));

    Assertions.assertEquals(2, _tree.rm("/files"));
    Assertions.assertEquals(List.of("/system", "/system/config"), _tree.paths());
  }

  @Test
  public void rmRejectsRootEmptyAndRelativePaths() {

    _tree.set("/files/etc/hosts/1/ipaddr", "127.0.0.1");
    _tree.set("/a", "1");
    var before = _tree.paths();

    Assertions.assertThrows(IllegalArgumentException.class, () -> _tree.rm(""));
    Assertions.assertThrows(IllegalArgumentException.class, () -> _tree.rm("/"));
    Assertions.assertThrows(IllegalArgumentException.class, () -> _tree.rm("a"));
    Assertions.assertThrows(NullPointerException.class, () -> _tree.rm(null));

    Assertions.assertEquals(before, _tree.paths());
    Assertions.assertEquals("1", _tree.get("/a"));
  }

  @Test
  public void lsListsOnlyImmediateChildren() {

    _tree.set("/a/b/c", "x");
    _tree.set("/a/d", "y");
    _tree.set("/ab/e", "z");

    Assertions.assertEquals(List.of("/a/b", "/a/d"), _tree.ls("/a"));
    Assertions.assertEquals(List.of("/a/b", "/a/d"), _tree.ls("/a/"));
    Assertions.assertEquals(2, _tree.countChildren("/a"));
    Assertions.assertEquals(List.of("/system", "/a", "/ab"), _tree.ls("/"));
    Assertions.assertEquals(List.of(), _tree.ls("/a/d"));
    Assertions.assertEquals(0, _tree.countChildren("/missing"));
  }

  @Test
  public void lsEntriesAreUnique() {

    _tree.set("/a/x", "1");
    _tree.set("/a/x", "2");
    _tree.insert("/a/y", "/a/x");
    _tree.insert("/a/x", "/a/y");

    var children = _tree.ls("/a");

    Assertions.assertEquals(children.size(), new HashSet<>(children).size());
    Assertions.assertEquals(List.of("/a/x", "/a/y"), children);
  }

  @Test
  public void matchReturnsTotalBeyondCapacity() {

    _tree.set("/a/1", "x");
    _tree.set("/a/2", "y");
    _tree.set("/a/3", "z");

    var matches = new ArrayList<String>();
    var total = _tree.match("/a/*", matches, 1);

    Assertions.assertEquals(3, total);
    Assertions.assertEquals(List.of("/a/1"), matches);
  }

  @Test
  public void matchWithZeroCapacityOnlyCounts() {

    _tree.set("/a/1", "x");

    Assertions.assertEquals(1, _tree.match("/a/?", null, 0));
  }

  @Test
  public void matchStarCrossesSeparators() {

    _tree.set("/files/etc/hosts/1/ipaddr", "127.0.0.1");

    Assertions.assertEquals(
      List.of("/files/etc/hosts/1/ipaddr"),
      _tree.match("/files/*/ipaddr")
    );
    Assertions.assertEquals(List.of("/system", "/system/config"), _tree.match("/sys*"));
  }

  @Test
  public void matchRejectsNegativeCapacity() {

    Assertions.assertThrows(IllegalArgumentException.class, () -> _tree.match("*", new ArrayList<>(), -1));
  }

  @Test
  public void printWritesEntriesWithPrefix() {

    _tree.set("/a/b", "x");
    _tree.set("/ab", "y");
    _tree.set("/c", "z");

    var output = _print("/a");

    Assertions.assertEquals(String.join(System.lineSeparator(), "/a", "/a/b = x", "/ab = y", ""), output);
  }

  @Test
  public void printWithoutPathWritesEverything() {

    _tree.set("/a", "x");

    var output = _print(null);

    Assertions.assertEquals(String.join(System.lineSeparator(), "/system", "/system/config", "/a = x", ""), output);
  }

  @Test
  public void printReportsBrokenLinksWithoutChangingTree() {

    _tree.set("/a", "1");
    _tree.set("/b", "2");

    var node = _tree.find("/b");
    var realPrev = node.prev;
    node.prev = _tree.find("/system");

    var out = new ByteArrayOutputStream();
    var linkErrors = _tree.print(new PrintStream(out, true, StandardCharsets.UTF_8), null);

    Assertions.assertEquals(2, linkErrors);
    Mockito.verify(_logger).warn("Wrong prev->next for /b");
    Mockito.verify(_logger).warn("Wrong next->prev for /a");
    Mockito.verify(_statsRecorder, Mockito.times(2))
      .recordCounterIncrement(Mockito.eq(PathStoreConsts.STATS_TAGS), Mockito.eq("link_errors"));
    Assertions.assertSame(_tree.find("/system"), node.prev);

    node.prev = realPrev;
    Assertions.assertEquals(0, _tree.print(new PrintStream(new ByteArrayOutputStream()), null));
  }

  @Test
  public void operationsRecordCounters() {

    _tree.set("/a", "1");
    _tree.get("/a");
    _tree.exists("/a");

    Mockito.verify(_statsRecorder).recordCounterIncrement(PathStoreConsts.STATS_TAGS, "set_attempts");
    Mockito.verify(_statsRecorder).recordCounterIncrement(PathStoreConsts.STATS_TAGS, "get_attempts");
    Mockito.verify(_statsRecorder).recordCounterIncrement(PathStoreConsts.STATS_TAGS, "exists_attempts");
  }

  private String _print(String path) {

    var out = new ByteArrayOutputStream();
    _tree.print(new PrintStream(out, true, StandardCharsets.UTF_8), path);

    return out.toString(StandardCharsets.UTF_8);
  }
}
