package com.example.teambalancer.service;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ProfileHandlesTest {

  @Test
  void extractsHandleFromProfileUrls() {
    assertThat(ProfileHandles.extract("https://www.faceit.com/en/players/s1mple"))
        .isEqualTo("s1mple");
    assertThat(ProfileHandles.extract("https://faceit.com/player/ZywOo/stats")).isEqualTo("ZywOo");
    assertThat(ProfileHandles.extract("http://www.faceit.com/players/device?tab=cs2"))
        .isEqualTo("device");
  }

  @Test
  void stripsLeadingAtAndWhitespace() {
    assertThat(ProfileHandles.extract("  @NiKo ")).isEqualTo("NiKo");
    assertThat(ProfileHandles.extract("electronic")).isEqualTo("electronic");
  }

  @Test
  void returnsEmptyForBlankInput() {
    assertThat(ProfileHandles.extract(null)).isEmpty();
    assertThat(ProfileHandles.extract("   ")).isEmpty();
    assertThat(ProfileHandles.extract("@")).isEmpty();
  }
}
