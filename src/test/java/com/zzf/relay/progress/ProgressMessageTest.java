package com.zzf.relay.progress;

import com.zzf.relay.channel.ReplyChannel;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ProgressMessageTest {

    @Test
    void shouldPostOnFirstShowThenEdit() {
        ReplyChannel channel = mock(ReplyChannel.class);
        when(channel.sendProgress("one", "cancel_x")).thenReturn("h-1");
        ProgressMessage message = new ProgressMessage(channel, "cancel_x");

        message.show("one");
        message.show("two");

        verify(channel).sendProgress("one", "cancel_x");
        verify(channel).edit("h-1", "two");
        assertTrue(message.isPosted());
    }

    @Test
    void shouldDeleteOnceAndIgnoreLaterShows() {
        ReplyChannel channel = mock(ReplyChannel.class);
        when(channel.sendProgress(anyString(), anyString())).thenReturn("h-2");
        ProgressMessage message = new ProgressMessage(channel, "cancel_y");
        message.show("one");

        message.remove();
        message.remove();
        message.show("late");

        verify(channel, times(1)).delete("h-2");
        verify(channel, never()).edit(anyString(), anyString());
        assertFalse(message.isPosted());
    }

    @Test
    void shouldAbsorbDeleteFailure() {
        ReplyChannel channel = mock(ReplyChannel.class);
        when(channel.sendProgress(anyString(), anyString())).thenReturn("h-3");
        doThrow(new IllegalStateException("unknown message")).when(channel).delete("h-3");
        ProgressMessage message = new ProgressMessage(channel, "cancel_z");
        message.show("one");

        assertDoesNotThrow(message::remove);
    }

    @Test
    void removeWithoutPostShouldNotTouchChannel() {
        ReplyChannel channel = mock(ReplyChannel.class);
        new ProgressMessage(channel, "cancel_w").remove();
        verify(channel, never()).delete(anyString());
    }
}
