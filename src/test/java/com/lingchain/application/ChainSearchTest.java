package com.lingchain.application;

import com.lingchain.application.port.Dictionary;
import com.lingchain.domain.ChainNode;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ChainSearchTest {
  private static final Set<String> STARTING =
      Set.of("starting", "stating", "statin", "satin", "sati", "sat", "at", "a");

  private final ChainSearch search = new ChainSearch(new FrontierExpander(), new PathReconstructor());

  @Test
  void findsFullChainFromStarting() {
    Set<List<String>> chains = search.search("starting", Dictionary.of(STARTING));

    assertEquals(
        Set.of(List.of("starting", "stating", "statin", "satin", "sati", "sat", "at", "a")),
        chains);
  }

  @Test
  void wordWithoutValidDeletionIsItsOwnChain() {
    Set<List<String>> chains = search.search("cat", Dictionary.of(Set.of("at", "a")));

    assertEquals(Set.of(List.of("cat")), chains);
  }

  @Test
  void emptyInputYieldsEmptyChain() {
    assertEquals(Set.of(List.of("")), search.search("", Dictionary.of(STARTING)));
    assertEquals(Set.of(List.of("")), search.search("", Dictionary.of(Set.of(""))));
  }

  @Test
  void branchThatDiesEarlyIsDropped() {
    Set<List<String>> chains = search.search("bat", Dictionary.of(Set.of("bat", "at", "bt", "a")));

    assertEquals(Set.of(List.of("bat", "at", "a")), chains);
  }

  @Test
  void returnsAllTiedChains() {
    Set<List<String>> chains = search.search("abc", Dictionary.of(Set.of("ab", "bc", "b")));

    assertEquals(Set.of(List.of("abc", "ab", "b"), List.of("abc", "bc", "b")), chains);
  }

  @Test
  void rootNeedNotBeAWord() {
    Set<List<String>> chains = search.search("xsat", Dictionary.of(STARTING));

    assertEquals(Set.of(List.of("xsat", "sat", "at", "a")), chains);
  }

  @Test
  void repeatedLettersProduceOneChainPerDistinctPath() {
    Set<List<String>> chains = search.search("aab", Dictionary.of(Set.of("aa", "ab", "a")));

    assertEquals(Set.of(List.of("aab", "ab", "a"), List.of("aab", "aa", "a")), chains);
  }

  @Test
  void chainsSatisfyDeletionMembershipAndMaximality() {
    Set<String> words =
        Set.of("planets", "planet", "plane", "plan", "pan", "lane", "lan", "an", "a", "n", "plnet");
    Dictionary dict = Dictionary.of(words);

    Set<List<String>> chains = search.search("planets", dict);

    assertFalse(chains.isEmpty());
    int length = chains.iterator().next().size();
    for (List<String> chain : chains) {
      assertEquals("planets", chain.get(0));
      assertEquals(length, chain.size());
      for (int i = 1; i < chain.size(); i++) {
        String prev = chain.get(i - 1);
        String cur = chain.get(i);
        assertEquals(prev.length() - 1, cur.length());
        assertTrue(words.contains(cur));
        assertTrue(FrontierExpander.deletions(prev).contains(cur), prev + " -> " + cur);
      }
      String last = chain.get(chain.size() - 1);
      assertTrue(FrontierExpander.deletions(last).stream().noneMatch(words::contains), last);
    }
    assertTrue(chains.contains(List.of("planets", "planet", "plane", "plan", "pan", "an", "a")));
    assertTrue(chains.contains(List.of("planets", "planet", "plane", "lane", "lan", "an", "a")));
  }

  @Test
  void expandsAtMostInputLengthPlusOneTimes() {
    AtomicInteger calls = new AtomicInteger();
    FrontierExpander counting =
        new FrontierExpander() {
          @Override
          public List<ChainNode> expand(Collection<ChainNode> frontier, Dictionary dictionary) {
            calls.incrementAndGet();
            return super.expand(frontier, dictionary);
          }
        };
    ChainSearch s = new ChainSearch(counting, new PathReconstructor());
    Set<String> all = Set.of("aaaa", "aaa", "aa", "a", "");

    Set<List<String>> chains = s.search("aaaa", Dictionary.of(all));

    assertEquals(Set.of(List.of("aaaa", "aaa", "aa", "a", "")), chains);
    assertTrue(calls.get() <= "aaaa".length() + 1);
  }
}
