package relaykit;

final class TestEvents {

  private TestEvents() {
  }

  record LoginEvent(int userId) {
  }

  record TabEvent(int position) {
  }

  static class BaseEvent {
  }

  static final class DerivedEvent extends BaseEvent {
  }
}
