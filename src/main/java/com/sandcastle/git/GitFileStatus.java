package com.sandcastle.git;

/**
 * @param staged   change recorded in the index
 * @param unstaged change in the working tree not yet staged
 */
public record GitFileStatus(String path, GitChange staged, GitChange unstaged) {}
