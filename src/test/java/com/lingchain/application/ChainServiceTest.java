package com.lingchain.application;

import com.lingchain.application.port.Dictionary;
import com.lingchain.domain.ChainResult;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ChainServiceTest {
  private final Dictionary dict = Dictionary.of(Set.of("bat", "at", "bt", "a"));

  @Test
  void recordsDictionaryMembershipOfInput() {
    ChainService svc =
        new ChainService(dict, new ChainSearch(new FrontierExpander(), new PathReconstructor()));

    ChainResult known = svc.findChains("bat");
    ChainResult unknown = svc.findChains("bats");

    assertTrue(known.inDictionary());
    assertEquals(Set.of(List.of("bat", "at", "a")), known.chains());
    assertFalse(unknown.inDictionary());
    assertEquals(Set.of(List.of("bats", "bat", "at", "a")), unknown.chains());
  }

  @Test
  void searchesWithItsOwnDictionary() {
    ChainSearch search = mock(ChainSearch.class);
    when(search.search(eq("at"), any())).thenReturn(Set.of(List.of("at", "a")));
    ChainService svc = new ChainService(dict, search);

    ChainResult r = svc.findChains("at");

    verify(search).search("at", dict);
    assertEquals(2, r.length());
  }

  @Test
  void rejectsNullWord() {
    ChainService svc = new ChainService(dict, mock(ChainSearch.class));

    assertThrows(IllegalArgumentException.class, () -> svc.findChains(null));
  }
}
