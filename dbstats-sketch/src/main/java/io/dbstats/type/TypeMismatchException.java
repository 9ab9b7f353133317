package io.dbstats.type;

/**
 * Thrown when a {@link Value} is read through an accessor of another type,
 * or when its payload does not match its declared {@link TypeId}.
 */
public class TypeMismatchException extends RuntimeException
{
  private final TypeId declared;
  private final TypeId requested;

  public TypeMismatchException(TypeId declared, TypeId requested, Object payload)
  {
    super(String.format(
        "cannot read %s value as %s (payload %s)",
        declared,
        requested,
        payload == null ? "null" : payload.getClass().getSimpleName()
    ));
    this.declared = declared;
    this.requested = requested;
  }

  public TypeId getDeclared()
  {
    return declared;
  }

  public TypeId getRequested()
  {
    return requested;
  }
}
