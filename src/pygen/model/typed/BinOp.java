package pygen.model.typed;

public enum BinOp {
	AND,
	OR,
	EQ,
	NOT_EQ,
	LT_INT,
	LT_EQ_INT,
	LT_FLOAT,
	LT_EQ_FLOAT,
	GT_EQ_INT,
	GT_INT,
	GT_EQ_FLOAT,
	GT_FLOAT,
	ADD_INT,
	ADD_FLOAT,
	SUB_INT,
	SUB_FLOAT,
	MULT_INT,
	MULT_FLOAT,
	DIV_INT,
	DIV_FLOAT,
	REMAINDER_INT,
	CONCATENATE,
}
