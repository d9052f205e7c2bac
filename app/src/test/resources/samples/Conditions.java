package samples;

class Conditions {
  void examples() {
    use(a && b);
    use(a && b || c);
    use(a && (b || c));
    use(fn(a.something.get("moo")) && items.stream().allMatch(Item::ok) && !(a + b > 0));
    use(a && !(a + b > 0));
    use(!(a + b > 0));
    use(!a);
    use("x" && "y");
  }
}
