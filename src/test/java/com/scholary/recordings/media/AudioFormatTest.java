package com.scholary.recordings.media;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class AudioFormatTest {

  @Test
  void contentTypeFor_shouldMapKnownExtensions() {
    assertThat(AudioFormat.contentTypeFor("call.aac")).isEqualTo("audio/aac");
    assertThat(AudioFormat.contentTypeFor("call.MP3")).isEqualTo("audio/mpeg");
    assertThat(AudioFormat.contentTypeFor("call.m4a")).isEqualTo("audio/mp4");
    assertThat(AudioFormat.contentTypeFor("call.wav")).isEqualTo("audio/wav");
    assertThat(AudioFormat.contentTypeFor("call.ogg")).isEqualTo("audio/ogg");
  }

  @Test
  void contentTypeFor_shouldDefaultToAac() {
    assertThat(AudioFormat.contentTypeFor("call.bin")).isEqualTo("audio/aac");
    assertThat(AudioFormat.contentTypeFor(null)).isEqualTo("audio/aac");
  }

  @Test
  void fromContentType_shouldIgnoreCase() {
    assertThat(AudioFormat.fromContentType("Audio/MPEG")).contains(AudioFormat.MP3);
    assertThat(AudioFormat.fromContentType("video/mp4")).isEmpty();
  }
}
