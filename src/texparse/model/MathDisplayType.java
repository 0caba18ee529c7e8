package texparse.model;

public enum MathDisplayType {
	INLINE,
	DISPLAY
}
